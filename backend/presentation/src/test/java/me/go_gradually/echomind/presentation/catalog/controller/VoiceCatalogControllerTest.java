package me.go_gradually.echomind.presentation.catalog.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.echomind.application.catalog.model.VoiceDownloadException;
import me.go_gradually.echomind.application.catalog.usecase.VoiceCatalogUseCase;
import me.go_gradually.echomind.presentation.TestBootApplication;
import me.go_gradually.echomind.presentation.shared.error.ApiExceptionHandler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = {TestBootApplication.class, VoiceCatalogController.class, ApiExceptionHandler.class})
@AutoConfigureMockMvc
class VoiceCatalogControllerTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private VoiceCatalogUseCase useCase;

    @Test
    void installed_listsVoiceIds() throws Exception {
        when(useCase.installedVoiceIds()).thenReturn(List.of("en_GB-alan-low", "en_US-lessac-medium"));

        mockMvc.perform(get("/voices/installed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.voice_ids[0]").value("en_GB-alan-low"))
                .andExpect(jsonPath("$.voice_ids[1]").value("en_US-lessac-medium"));
    }

    @Test
    void download_returnsOkEnvelope() throws Exception {
        when(useCase.download("en_US-amy-low")).thenReturn("en_US-amy-low");

        mockMvc.perform(post("/voices/download")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("voice_id", "en_US-amy-low"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.voice_id").value("en_US-amy-low"));
    }

    @Test
    void download_returnsBadRequest_whenVoiceIdMissing() throws Exception {
        mockMvc.perform(post("/voices/download")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("voice_id required"));

        verify(useCase, never()).download(any());
    }

    @Test
    void download_returnsBadRequest_whenVoiceIdInvalid() throws Exception {
        when(useCase.download("bogus")).thenThrow(new IllegalArgumentException("Invalid Piper voice id: bogus"));

        mockMvc.perform(post("/voices/download")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("voice_id", "bogus"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid Piper voice id: bogus"));
    }

    @Test
    void download_returnsBadGateway_whenFetchFails() throws Exception {
        when(useCase.download("en_US-amy-low")).thenThrow(new VoiceDownloadException(
                "en_US-amy-low", "Download failed for en_US-amy-low: HTTP 404", null));

        mockMvc.perform(post("/voices/download")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("voice_id", "en_US-amy-low"))))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.detail").value("Download failed for en_US-amy-low: HTTP 404"));
    }
}
