package com.livedesk.support.chat.api;

import com.livedesk.support.chat.service.MessageIngestionService;
import com.livedesk.support.common.api.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api/v1")
public class ChatController {

    private final MessageIngestionService ingestionService;

    public ChatController(MessageIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping("/analyze-message")
    public ApiResponse<AnalyzeMessageResponse> analyzeMessage(@Valid @RequestBody AnalyzeMessageRequest req) {
        var result = ingestionService.ingestCustomerText(req.customer_id().trim(), req.customer_name().trim(), req.text());
        return ApiResponse.ok(new AnalyzeMessageResponse(
                result.conversation().id(),
                result.message().id(),
                result.message().text(),
                null,
                null,
                null,
                result.analysis(),
                result.message().createdAt()
        ));
    }

    @PostMapping(value = "/analyze-image-message", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ApiResponse<AnalyzeMessageResponse> analyzeImageMessage(
            @RequestParam("file") MultipartFile file,
            @RequestParam("customer_id") String customerId,
            @RequestParam("customer_name") String customerName,
            @RequestParam(value = "text", required = false) String text
    ) {
        requireText(customerId, "customer_id_required");
        requireText(customerName, "customer_name_required");
        var contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new IllegalArgumentException("file_not_image");
        }

        var result = ingestionService.ingestCustomerImage(
                customerId.trim(), customerName.trim(), text, readBytes(file), contentType);
        return ApiResponse.ok(new AnalyzeMessageResponse(
                result.conversation().id(),
                result.message().id(),
                result.message().text(),
                result.message().mediaRef(),
                result.message().extractedText(),
                null,
                result.analysis(),
                result.message().createdAt()
        ));
    }

    @PostMapping(value = "/transcribe-audio", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ApiResponse<AnalyzeMessageResponse> transcribeAudio(
            @RequestParam("file") MultipartFile file,
            @RequestParam("customer_id") String customerId,
            @RequestParam("customer_name") String customerName
    ) {
        requireText(customerId, "customer_id_required");
        requireText(customerName, "customer_name_required");

        var filename = file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()
                ? "recording.wav"
                : file.getOriginalFilename();
        var result = ingestionService.ingestCustomerAudio(customerId.trim(), customerName.trim(), readBytes(file), filename);
        return ApiResponse.ok(new AnalyzeMessageResponse(
                result.conversation().id(),
                result.message().id(),
                result.message().text(),
                null,
                null,
                result.message().extractedText(),
                result.analysis(),
                result.message().createdAt()
        ));
    }

    @PostMapping("/send-agent-message")
    public ApiResponse<AgentMessageResponse> sendAgentMessage(@Valid @RequestBody SendAgentMessageRequest req) {
        var result = ingestionService.sendAgentReply(
                req.conversation_id().trim(), req.agent_id().trim(), req.agent_name().trim(), req.message());
        return ApiResponse.ok(new AgentMessageResponse(
                result.conversation().id(),
                result.message().id(),
                result.message().senderId(),
                result.message().senderName(),
                result.message().text(),
                result.message().createdAt()
        ));
    }

    private static void requireText(String value, String code) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(code);
        }
    }

    private static byte[] readBytes(MultipartFile file) {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("file_empty");
        }
        try {
            return file.getBytes();
        } catch (IOException ex) {
            throw new IllegalArgumentException("file_unreadable", ex);
        }
    }
}
