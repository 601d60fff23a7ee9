package videodigest.infrastructure.transcript;

import videodigest.infrastructure.transcript.api.TranscriptResponse;

public interface TranscriptClient {
    /**
     * @param videoLink The public link to the video
     * @param apiKey    The transcript API key
     * @return The transcript segments
     */
    TranscriptResponse getTranscript(String videoLink, String apiKey);
}
