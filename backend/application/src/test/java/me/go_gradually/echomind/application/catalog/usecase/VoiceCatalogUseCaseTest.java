package me.go_gradually.echomind.application.catalog.usecase;

import me.go_gradually.echomind.application.catalog.model.VoiceDownloadException;
import me.go_gradually.echomind.application.catalog.port.VoiceCatalogPort;
import me.go_gradually.echomind.domain.voice.PiperVoiceId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VoiceCatalogUseCaseTest {
    @Mock
    private VoiceCatalogPort catalogPort;

    private VoiceCatalogUseCase useCase;

    @BeforeEach
    void setUp() {
        useCase = new VoiceCatalogUseCase(catalogPort);
    }

    @Test
    void installedVoiceIds_delegatesToCatalog() {
        when(catalogPort.installedVoiceIds()).thenReturn(List.of("en_US-lessac-medium"));

        assertEquals(List.of("en_US-lessac-medium"), useCase.installedVoiceIds());
    }

    @Test
    void isInstalled_trimsAndRejectsBlank() {
        when(catalogPort.isInstalled("en_US-lessac-medium")).thenReturn(true);

        assertTrue(useCase.isInstalled(" en_US-lessac-medium "));
        assertFalse(useCase.isInstalled(" "));
        assertFalse(useCase.isInstalled(null));
    }

    @Test
    void download_parsesIdAndDelegates() throws Exception {
        String voiceId = useCase.download("en_US-amy-low");

        assertEquals("en_US-amy-low", voiceId);
        ArgumentCaptor<PiperVoiceId> captor = ArgumentCaptor.forClass(PiperVoiceId.class);
        verify(catalogPort).download(captor.capture());
        assertEquals("en/en_US/amy/low/en_US-amy-low", captor.getValue().repositoryPath());
    }

    @Test
    void download_rejectsInvalidIdBeforeTouchingCatalog() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> useCase.download("not-a-voice"));

        verify(catalogPort, never()).download(any());
    }

    @Test
    void download_wrapsCatalogFailure() throws Exception {
        doThrow(new IOException("HTTP 404")).when(catalogPort).download(any());

        VoiceDownloadException error = assertThrows(VoiceDownloadException.class, () -> useCase.download("en_US-amy-low"));

        assertEquals("Download failed for en_US-amy-low: HTTP 404", error.getMessage());
        assertEquals("en_US-amy-low", error.getVoiceId());
    }

    @Test
    void installedVoiceIds_emptyCatalog() {
        when(catalogPort.installedVoiceIds()).thenReturn(List.of());

        assertTrue(useCase.installedVoiceIds().isEmpty());
    }
}
