package me.go_gradually.echomind.domain.command;

public record MemoryQuery(MemoryQueryType type, double minutes, String topic) {
    public static final double DEFAULT_MINUTES = 5.0;

    public MemoryQuery {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        minutes = minutes > 0 ? minutes : DEFAULT_MINUTES;
        topic = topic == null ? "" : topic;
    }

    public int wholeMinutes() {
        return (int) minutes;
    }
}
