package com.channelcast.channel.telegram;

import com.channelcast.channel.ChannelDeliveryException;
import com.channelcast.channel.ChannelTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Posts text messages through the Telegram Bot API {@code sendMessage} method.
 */
@Slf4j
public class TelegramTransport implements ChannelTransport {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final MediaType JSON = MediaType.parse("application/json");

    private static final Pattern PARSE_ERR_RE = Pattern.compile(
            "can't parse entities|parse entities|find end of the entity",
            Pattern.CASE_INSENSITIVE);

    private final OkHttpClient httpClient;
    private final String apiBaseUrl;
    private final String token;
    private final String parseMode;

    /**
     * @param timeout applied to connect, read and the whole call
     */
    public TelegramTransport(String token, String apiBaseUrl, String parseMode, Duration timeout) {
        this(new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build(), token, apiBaseUrl, parseMode);
    }

    public TelegramTransport(OkHttpClient httpClient, String token, String apiBaseUrl, String parseMode) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Telegram bot token is required");
        }
        this.httpClient = httpClient;
        this.token = token;
        this.apiBaseUrl = stripTrailingSlash(apiBaseUrl != null ? apiBaseUrl : "https://api.telegram.org");
        this.parseMode = parseMode;
    }

    @Override
    public String send(String channelId, String text) throws ChannelDeliveryException {
        String chatId;
        try {
            chatId = TelegramTargets.normalizeChatId(channelId);
        } catch (IllegalArgumentException e) {
            throw new ChannelDeliveryException(channelId, e.getMessage(), e);
        }
        try {
            return post(channelId, buildSendMessageBody(chatId, text, parseMode));
        } catch (ChannelDeliveryException e) {
            if (parseMode != null && !parseMode.isBlank() && isParseError(e.getMessage())) {
                log.warn("telegram: {} rejected {} formatting, resending as plain text", chatId, parseMode);
                return post(channelId, buildSendMessageBody(chatId, text, null));
            }
            throw e;
        }
    }

    private String post(String channelId, String body) throws ChannelDeliveryException {
        Request request = new Request.Builder()
                .url(apiBaseUrl + "/bot" + token + "/sendMessage")
                .post(RequestBody.create(body, JSON))
                .build();
        int status;
        String responseText;
        try (Response response = httpClient.newCall(request).execute()) {
            status = response.code();
            ResponseBody responseBody = response.body();
            responseText = responseBody != null ? responseBody.string() : null;
        } catch (IOException e) {
            throw new ChannelDeliveryException(channelId, "Telegram request failed: " + e.getMessage(), e);
        }
        return parseSendResponse(channelId, status, responseText);
    }

    /**
     * Build the JSON body for {@code sendMessage}.
     */
    static String buildSendMessageBody(String chatId, String text, String parseMode) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("chat_id", chatId);
        node.put("text", text);
        if (parseMode != null && !parseMode.isBlank()) {
            node.put("parse_mode", parseMode);
        }
        node.put("disable_web_page_preview", true);
        return node.toString();
    }

    /**
     * Extract {@code result.message_id} from a Bot API response or raise the
     * API's error description.
     */
    static String parseSendResponse(String channelId, int status, String body) throws ChannelDeliveryException {
        JsonNode root;
        try {
            root = body == null || body.isBlank() ? null : MAPPER.readTree(body);
        } catch (IOException e) {
            throw new ChannelDeliveryException(channelId,
                    "Telegram returned unreadable response (HTTP " + status + ")", e);
        }
        if (root == null) {
            throw new ChannelDeliveryException(channelId, "Telegram returned empty response (HTTP " + status + ")");
        }
        if (root.path("ok").asBoolean(false)) {
            JsonNode messageId = root.path("result").path("message_id");
            if (messageId.isMissingNode() || messageId.isNull()) {
                throw new ChannelDeliveryException(channelId, "Telegram response has no message_id");
            }
            return messageId.asText();
        }
        String description = root.path("description").asText("unknown error");
        int errorCode = root.path("error_code").asInt(status);
        long retryAfterMs = -1;
        JsonNode retryAfter = root.path("parameters").path("retry_after");
        if (retryAfter.canConvertToLong() && retryAfter.asLong() > 0) {
            retryAfterMs = retryAfter.asLong() * 1000;
        }
        throw new ChannelDeliveryException(channelId,
                "Telegram error " + errorCode + ": " + description, retryAfterMs, null);
    }

    /**
     * Check if an error message indicates a Telegram formatting parse failure.
     */
    static boolean isParseError(String errorMessage) {
        if (errorMessage == null)
            return false;
        return PARSE_ERR_RE.matcher(errorMessage).find();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
