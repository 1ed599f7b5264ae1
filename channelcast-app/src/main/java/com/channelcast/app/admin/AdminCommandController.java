package com.channelcast.app.admin;

import com.channelcast.app.commands.CommandProcessor;
import com.channelcast.app.commands.CommandResult;
import com.channelcast.common.config.ChannelCastConfig;
import com.channelcast.common.config.ConfigService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Operator command endpoint.
 * <p>
 * {@code POST /admin/commands} with {@code {"text":"/job_list","senderId":"42"}}.
 * When {@code admin.token} is set, the {@code X-Admin-Token} header must match it.
 */
@Slf4j
@RestController
public class AdminCommandController {

    public static final String TOKEN_HEADER = "X-Admin-Token";

    private final ObjectMapper mapper = new ObjectMapper();
    private final CommandProcessor processor;
    private final ConfigService configService;

    public AdminCommandController(CommandProcessor processor, ConfigService configService) {
        this.processor = processor;
        this.configService = configService;
    }

    public record CommandRequest(String text, String senderId) {
    }

    @PostMapping("/admin/commands")
    public ResponseEntity<ObjectNode> execute(@RequestBody CommandRequest request,
            @RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        ChannelCastConfig config = configService.loadConfig();
        if (!tokenMatches(config.getAdmin().getToken(), token)) {
            log.warn("Rejected admin command: bad or missing {}", TOKEN_HEADER);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(reply(false, true, "Invalid admin token."));
        }
        String text = request != null ? request.text() : null;
        CommandResult result = processor.handleCommand(text, request != null ? request.senderId() : null, config);
        if (result == null) {
            return ResponseEntity.badRequest().body(reply(false, true, "Unknown command. Try /help."));
        }
        return ResponseEntity.ok(reply(true, result.error(), result.text()));
    }

    static boolean tokenMatches(String expected, String supplied) {
        if (expected == null || expected.isBlank()) {
            return true;
        }
        if (supplied == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                supplied.getBytes(StandardCharsets.UTF_8));
    }

    private ObjectNode reply(boolean handled, boolean error, String text) {
        ObjectNode node = mapper.createObjectNode();
        node.put("handled", handled);
        node.put("error", error);
        node.put("text", text);
        return node;
    }
}
