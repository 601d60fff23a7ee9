package videodigest.infrastructure.assistant.api;

public record AssistantMessage(String role, String content) {
}
