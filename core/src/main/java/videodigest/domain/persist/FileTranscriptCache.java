package videodigest.domain.persist;

import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import videodigest.domain.exceptionhandling.ExceptionHandler;
import videodigest.domain.exceptions.LocalStorageFailure;
import videodigest.domain.json.JsonDeserializer;
import videodigest.domain.persist.config.LocalStorageCacheDirectory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Saves each transcript as a JSON file in the local cache directory.
 * Files are written to a temporary file first and then moved into place, so two overlapping runs
 * writing the same video can never leave a partially written entry behind.
 */
@ApplicationScoped
public class FileTranscriptCache implements TranscriptCache {
    private static final String FILE_PREFIX = "transcript_";
    private static final String FILE_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    @Inject
    private Logger logger;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private LocalStorageCacheDirectory localStorageCacheDirectory;

    /**
     * Video ids are hashed so any id maps to a valid file name.
     */
    static String fileNameFor(final String videoId) {
        return FILE_PREFIX + DigestUtils.sha256Hex(videoId) + FILE_SUFFIX;
    }

    @Override
    public Optional<TranscriptCacheEntry> get(final String videoId) {
        checkArgument(StringUtils.isNotBlank(videoId), "videoId must not be blank");

        final Path path = Path.of(localStorageCacheDirectory.getCacheDirectory(), fileNameFor(videoId));

        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }

        return Try.of(() -> Files.readString(path, StandardCharsets.UTF_8))
                .map(json -> jsonDeserializer.deserialize(json, TranscriptCacheEntry.class))
                .filter(entry -> videoId.equals(entry.videoId()) && entry.text() != null)
                .onFailure(ex -> {
                    // A NoSuchElementException is raised by the filter, and is just a miss
                    if (!(ex instanceof NoSuchElementException)) {
                        logger.warning("Ignoring unreadable cache file " + path + ": " + exceptionHandler.getExceptionMessage(ex));
                    }
                })
                .toJavaOptional();
    }

    @Override
    public Try<TranscriptCacheEntry> put(final String videoId, final String text) {
        checkArgument(StringUtils.isNotBlank(videoId), "videoId must not be blank");
        checkNotNull(text, "text must not be null");

        final TranscriptCacheEntry entry = new TranscriptCacheEntry(videoId, text, Instant.now());

        return Try.of(() -> Path.of(localStorageCacheDirectory.getCacheDirectory()))
                .mapTry(Files::createDirectories)
                .mapTry(directory -> writeAtomically(directory, fileNameFor(videoId), jsonDeserializer.serialize(entry)))
                .peek(path -> logger.fine("Saved transcript for video " + videoId + " to " + path))
                .map(path -> entry)
                .mapFailure(API.Case(API.$(), ex -> new LocalStorageFailure(
                        "Failed to save the transcript for video " + videoId, ex)));
    }

    private Path writeAtomically(final Path directory, final String fileName, final String contents) throws IOException {
        final Path target = directory.resolve(fileName);
        final Path temp = Files.createTempFile(directory, fileName, TEMP_SUFFIX);

        try {
            Files.writeString(temp, contents, StandardCharsets.UTF_8);
            return Try.of(() -> Files.move(temp, target, ATOMIC_MOVE, REPLACE_EXISTING))
                    // Some file systems can not rename atomically. A replace is the best we can do there.
                    .recoverWith(AtomicMoveNotSupportedException.class, ex -> Try.of(() -> Files.move(temp, target, REPLACE_EXISTING)))
                    .get();
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
