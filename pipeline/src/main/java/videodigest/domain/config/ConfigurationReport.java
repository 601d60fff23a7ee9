package videodigest.domain.config;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Describes the settings a run uses without revealing secrets, and checks that the settings a live run
 * needs are present.
 */
@ApplicationScoped
public class ConfigurationReport {
    private static final String NOT_SET = "<not set>";
    private static final int VISIBLE_SECRET_CHARS = 4;

    @Inject
    private MockConfig mockConfig;

    @Inject
    @ConfigProperty(name = "vd.channel.id")
    private Optional<String> channelId;

    @Inject
    @ConfigProperty(name = "vd.channel.titlePattern", defaultValue = "KS Forward")
    private String titlePattern;

    @Inject
    @ConfigProperty(name = "vd.youtube.apikey")
    private Optional<String> youtubeApiKey;

    @Inject
    @ConfigProperty(name = "vd.transcript.apikey")
    private Optional<String> transcriptApiKey;

    @Inject
    @ConfigProperty(name = "vd.assistant.url")
    private Optional<String> assistantUrl;

    @Inject
    @ConfigProperty(name = "vd.assistant.apikey")
    private Optional<String> assistantApiKey;

    @Inject
    @ConfigProperty(name = "vd.chat.webhook")
    private Optional<String> chatWebhook;

    @Inject
    @ConfigProperty(name = "vd.cache.localdir", defaultValue = "localcache")
    private String cacheDirectory;

    /**
     * Keys longer than eight characters keep their first and last four characters. Shorter keys are hidden entirely.
     */
    public static String maskSecret(@Nullable final String secret) {
        if (StringUtils.isBlank(secret)) {
            return NOT_SET;
        }

        if (secret.length() <= VISIBLE_SECRET_CHARS * 2) {
            return "***";
        }

        return secret.substring(0, VISIBLE_SECRET_CHARS) + "..." + secret.substring(secret.length() - VISIBLE_SECRET_CHARS);
    }

    /**
     * Webhook URLs embed their token in the path, so only the scheme and host are shown.
     */
    public static String maskUrl(@Nullable final String url) {
        if (StringUtils.isBlank(url)) {
            return NOT_SET;
        }

        return Try.of(() -> URI.create(url))
                .filter(uri -> uri.getScheme() != null && uri.getHost() != null)
                .map(uri -> uri.getScheme() + "://" + uri.getHost() + "/***")
                .getOrElse("***");
    }

    /**
     * @return The settings in display order, with secrets masked
     */
    public Map<String, String> describe() {
        final Map<String, String> settings = new LinkedHashMap<>();
        settings.put("vd.infrastructure.mock", String.valueOf(mockConfig.isMock()));
        settings.put("vd.transcript.mock", String.valueOf(mockConfig.isMockTranscript()));
        settings.put("vd.channel.id", channelId.orElse(NOT_SET));
        settings.put("vd.channel.titlePattern", titlePattern);
        settings.put("vd.youtube.apikey", maskSecret(youtubeApiKey.orElse(null)));
        settings.put("vd.transcript.apikey", maskSecret(transcriptApiKey.orElse(null)));
        settings.put("vd.assistant.url", assistantUrl.orElse(NOT_SET));
        settings.put("vd.assistant.apikey", maskSecret(assistantApiKey.orElse(null)));
        settings.put("vd.chat.webhook", maskUrl(chatWebhook.orElse(null)));
        settings.put("vd.cache.localdir", cacheDirectory);
        return settings;
    }

    /**
     * @return A description of each missing or invalid setting. Empty when the configuration is usable.
     */
    public List<String> validate() {
        final List<String> problems = new ArrayList<>();

        if (channelId.filter(StringUtils::isNotBlank).isEmpty()) {
            problems.add("vd.channel.id must be set");
        }

        if (StringUtils.isBlank(titlePattern)) {
            problems.add("vd.channel.titlePattern must not be blank");
        }

        // Mock mode replaces every remote service, so none of their settings are needed
        if (mockConfig.isMock()) {
            return problems;
        }

        requireSet(problems, "vd.youtube.apikey", youtubeApiKey);
        if (!mockConfig.isMockTranscript()) {
            requireSet(problems, "vd.transcript.apikey", transcriptApiKey);
        }
        requireUrl(problems, "vd.assistant.url", assistantUrl);
        requireUrl(problems, "vd.chat.webhook", chatWebhook);

        return problems;
    }

    private void requireSet(final List<String> problems, final String name, final Optional<String> value) {
        if (value.filter(StringUtils::isNotBlank).isEmpty()) {
            problems.add(name + " must be set");
        }
    }

    private void requireUrl(final List<String> problems, final String name, final Optional<String> value) {
        if (value.filter(StringUtils::isNotBlank).isEmpty()) {
            problems.add(name + " must be set");
        } else if (!StringUtils.startsWithAny(value.get(), "http://", "https://")) {
            problems.add(name + " must start with http:// or https://");
        }
    }
}
