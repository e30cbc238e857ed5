package skillcron.cron.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Runs skills on the agent service over HTTP.
 *
 * The agent answers a POST with a stream of newline-delimited JSON events:
 * <pre>
 * {"type":"text","content":"..."}
 * {"type":"error","content":"..."}
 * {"type":"done"}
 * </pre>
 */
public class HttpSkillRunner implements SkillRunner {

    private static final Logger log = LoggerFactory.getLogger(HttpSkillRunner.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client;
    private final URI endpoint;
    private final Duration timeout;

    public HttpSkillRunner(String agentUrl, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), URI.create(agentUrl), timeout);
    }

    HttpSkillRunner(HttpClient client, URI endpoint, Duration timeout) {
        this.client = client;
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    @Override
    public void execute(Target target, String query, String profileId, String sessionId,
            AbortSignal signal, Consumer<SkillEvent> onEvent) throws Exception {

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("skillId", target.id());
        body.put("query", query);
        body.put("sessionId", sessionId);
        if (profileId != null) {
            body.put("profileId", profileId);
        }

        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/x-ndjson")
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
                .build();

        log.debug("Invoking skill {} (session {})", target.id(), sessionId);
        HttpResponse<Stream<String>> response = client.send(request, HttpResponse.BodyHandlers.ofLines());

        try (Stream<String> lines = response.body()) {
            if (response.statusCode() / 100 != 2) {
                String detail = lines.limit(5).reduce("", (a, b) -> a.isEmpty() ? b : a + " " + b);
                throw new IOException("Agent returned HTTP " + response.statusCode()
                        + (detail.isBlank() ? "" : ": " + detail));
            }

            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                if (signal.isAborted()) {
                    log.info("Skill {} aborted (session {})", target.id(), sessionId);
                    return;
                }
                String line = it.next();
                if (line.isBlank()) {
                    continue;
                }
                SkillEvent event = parse(line);
                onEvent.accept(event);
                if (SkillEvent.DONE.equals(event.type())) {
                    return;
                }
            }
        }
    }

    private SkillEvent parse(String line) {
        try {
            return MAPPER.readValue(line, SkillEvent.class);
        } catch (JsonProcessingException e) {
            // Non-JSON output is passed through as plain text
            return SkillEvent.text(line);
        }
    }
}
