package ae.teletronics.custody.adapters.transport;

import ae.teletronics.custody.application.exceptions.TransportException;
import ae.teletronics.custody.config.CustodyProperties;
import ae.teletronics.custody.domain.FileKind;
import ae.teletronics.custody.domain.model.TransportLocation;
import ae.teletronics.custody.ports.BlobTransportPort;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Blob transport backed by a Telegram channel: every payload is re-sent into the
 * channel by its file handle and lives there as a message.
 * Talks to the Bot API over plain HTTP/JSON.
 */
public class TelegramBlobTransport implements BlobTransportPort {

    private static final Logger log = LoggerFactory.getLogger(TelegramBlobTransport.class);

    private final WebClient http;
    private final CustodyProperties.Transport props;

    public TelegramBlobTransport(WebClient http, CustodyProperties.Transport props) {
        this.http = http;
        this.props = props;
    }

    @Override
    public Mono<StoredBlob> store(FileKind kind, String rawHandle, String caption) {
        Method m = Method.of(kind);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", props.channelId());
        body.put(m.field, rawHandle);
        body.put("caption", caption);

        return call(m.name, body)
                .map(result -> toStoredBlob(result, m.field, rawHandle))
                .doOnNext(b -> log.debug("Stored {} payload at {}", kind, b.location()));
    }

    @Override
    public Mono<Boolean> delete(TransportLocation location) {
        Map<String, Object> body = Map.of(
                "chat_id", location.channelId(),
                "message_id", location.messageId());
        return call("deleteMessage", body).map(JsonNode::asBoolean);
    }

    // ---- helpers ----

    /**
     * POSTs to the Bot API and unwraps {@code result}. The API answers with
     * {@code ok:false} plus a description on failure, usually with a 4xx status.
     */
    private Mono<JsonNode> call(String method, Map<String, Object> body) {
        return http.post()
                .uri(props.apiBaseUrl() + "/bot{token}/{method}", props.botToken(), method)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(resp -> resp.bodyToMono(JsonNode.class)
                        .switchIfEmpty(Mono.error(new TransportException(
                                method + " returned an empty body (HTTP " + resp.statusCode().value() + ")"))))
                .flatMap(json -> {
                    if (!json.path("ok").asBoolean(false)) {
                        String description = json.path("description").asText("unknown error");
                        return Mono.error(new TransportException(method + " failed: " + description));
                    }
                    return Mono.just(json.path("result"));
                });
    }

    private StoredBlob toStoredBlob(JsonNode message, String field, String rawHandle) {
        JsonNode media = message.path(field);
        if (media.isArray() && !media.isEmpty()) {
            media = media.get(media.size() - 1); // photos come in several sizes, the last one is the largest
        }
        String fileId = media.path("file_id").asText(null);
        String uniqueId = media.path("file_unique_id").asText("");
        if (fileId == null) {
            fileId = rawHandle;
        }
        long channelId = message.path("chat").path("id").asLong(props.channelId());
        long messageId = message.path("message_id").asLong(0L);
        if (messageId == 0L) {
            throw new TransportException("Telegram did not return a message id");
        }
        return new StoredBlob(fileId, uniqueId, new TransportLocation(channelId, messageId));
    }

    private enum Method {
        PHOTO("sendPhoto", "photo"),
        VIDEO("sendVideo", "video"),
        AUDIO("sendAudio", "audio"),
        VOICE("sendVoice", "voice"),
        DOCUMENT("sendDocument", "document");

        final String name;
        final String field;

        Method(String name, String field) {
            this.name = name;
            this.field = field;
        }

        static Method of(FileKind kind) {
            return switch (kind) {
                case PHOTO -> PHOTO;
                case VIDEO -> VIDEO;
                case AUDIO -> AUDIO;
                case VOICE -> VOICE;
                default -> DOCUMENT;
            };
        }
    }
}
