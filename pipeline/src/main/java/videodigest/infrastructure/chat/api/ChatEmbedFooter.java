package videodigest.infrastructure.chat.api;

public record ChatEmbedFooter(String text) {
}
