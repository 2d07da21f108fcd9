package com.livedesk.support.chat.service;

import com.livedesk.support.analysis.AnalysisRequest;
import com.livedesk.support.analysis.AnalysisResult;
import com.livedesk.support.analysis.AnalysisService;
import com.livedesk.support.chat.notify.Notification;
import com.livedesk.support.chat.repo.ConversationRepository;
import com.livedesk.support.chat.repo.CustomerRepository;
import com.livedesk.support.chat.repo.MessageRepository;
import com.livedesk.support.common.api.ConflictException;
import com.livedesk.support.common.api.NotFoundException;
import com.livedesk.support.media.MediaExtractionException;
import com.livedesk.support.media.OcrClient;
import com.livedesk.support.media.TranscriptionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Takes one inbound unit (customer text, screenshot, call recording or agent reply) through
 * resolve, extract, analyze, persist and notify, in that order.
 */
@Service
public class MessageIngestionService {

    private static final Logger log = LoggerFactory.getLogger(MessageIngestionService.class);

    static final String SCREENSHOT_PLACEHOLDER = "Screenshot shared.";

    public record IngestResult(
            ConversationRepository.ConversationRow conversation,
            MessageRepository.MessageRow message,
            AnalysisResult analysis
    ) {
    }

    private final CustomerRepository customerRepository;
    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final AnalysisService analysisService;
    private final OcrClient ocrClient;
    private final TranscriptionClient transcriptionClient;
    private final ConversationRouter router;

    public MessageIngestionService(
            CustomerRepository customerRepository,
            ConversationRepository conversationRepository,
            MessageRepository messageRepository,
            AnalysisService analysisService,
            OcrClient ocrClient,
            TranscriptionClient transcriptionClient,
            ConversationRouter router
    ) {
        this.customerRepository = customerRepository;
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.analysisService = analysisService;
        this.ocrClient = ocrClient;
        this.transcriptionClient = transcriptionClient;
        this.router = router;
    }

    public IngestResult ingestCustomerText(String customerId, String customerName, String text) {
        var customer = customerRepository.getOrCreate(customerId, customerName);
        var conversation = conversationRepository.getOrCreateOpen(customerId, ConversationRepository.SOURCE_LIVE_CHAT);

        var analysis = analysisService.analyze(new AnalysisRequest(
                text, null, AnalysisRequest.InputKind.CHAT_TEXT, historyOf(conversation.id())));

        var saved = messageRepository.save(new MessageRepository.NewMessage(
                conversation.id(), MessageRepository.SENDER_CUSTOMER, customerId, customer.fullName(),
                text, null, null, analysis));
        log.info("customer_message_saved conversation_id={} message_id={} intent={}",
                conversation.id(), saved.id(), analysis.predicted_intent());

        notifyCustomerUnit(conversation, saved, customer.fullName(), text, analysis);
        return new IngestResult(conversation, saved, analysis);
    }

    /**
     * The caption is optional. When OCR fails the caption alone is analyzed; an image with neither is rejected.
     */
    public IngestResult ingestCustomerImage(
            String customerId,
            String customerName,
            String caption,
            byte[] image,
            String contentType
    ) {
        var customer = customerRepository.getOrCreate(customerId, customerName);
        var conversation = conversationRepository.getOrCreateOpen(customerId, ConversationRepository.SOURCE_LIVE_CHAT);

        var cleanCaption = caption == null || caption.isBlank() ? null : caption.strip();
        String ocrText = null;
        MediaExtractionException ocrFailure = null;
        try {
            ocrText = ocrClient.extractText(image, contentType)
                    .map(String::strip)
                    .filter(s -> !s.isEmpty())
                    .orElse(null);
        } catch (MediaExtractionException ex) {
            ocrFailure = ex;
            log.warn("ocr_degraded conversation_id={} code={} has_caption={}",
                    conversation.id(), ex.getMessage(), cleanCaption != null);
        }
        if (ocrText == null && cleanCaption == null) {
            throw ocrFailure != null ? ocrFailure : new MediaExtractionException("no_text_extracted");
        }

        String textForAnalysis;
        if (cleanCaption == null) {
            textForAnalysis = "Text from screenshot: " + ocrText;
        } else if (ocrText == null) {
            textForAnalysis = cleanCaption;
        } else {
            textForAnalysis = cleanCaption + "\n(Text from screenshot: " + ocrText + ")";
        }

        var analysis = analysisService.analyze(new AnalysisRequest(
                textForAnalysis, ocrText, AnalysisRequest.InputKind.IMAGE, historyOf(conversation.id())));

        var storedText = cleanCaption == null ? SCREENSHOT_PLACEHOLDER : cleanCaption;
        var imageUrl = toDataUrl(image, contentType);
        var saved = messageRepository.save(new MessageRepository.NewMessage(
                conversation.id(), MessageRepository.SENDER_CUSTOMER, customerId, customer.fullName(),
                storedText, imageUrl, ocrText, analysis));
        log.info("customer_image_saved conversation_id={} message_id={} ocr_chars={} intent={}",
                conversation.id(), saved.id(), ocrText == null ? 0 : ocrText.length(), analysis.predicted_intent());

        notifyCustomerUnit(conversation, saved, customer.fullName(), textForAnalysis, analysis);
        return new IngestResult(conversation, saved, analysis);
    }

    public IngestResult ingestCustomerAudio(String customerId, String customerName, byte[] audio, String filename) {
        var customer = customerRepository.getOrCreate(customerId, customerName);
        var conversation = conversationRepository.getOrCreateOpen(customerId, ConversationRepository.SOURCE_RECORDED_CALL);

        var transcript = transcriptionClient.transcribe(audio, filename)
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .orElseThrow(() -> new MediaExtractionException("no_text_extracted"));

        var analysis = analysisService.analyze(new AnalysisRequest(
                transcript, null, AnalysisRequest.InputKind.CALL_TRANSCRIPTION, historyOf(conversation.id())));

        var saved = messageRepository.save(new MessageRepository.NewMessage(
                conversation.id(), MessageRepository.SENDER_CUSTOMER, customerId, customer.fullName(),
                transcript, filename, transcript, analysis));
        log.info("call_transcript_saved conversation_id={} message_id={} chars={} intent={}",
                conversation.id(), saved.id(), transcript.length(), analysis.predicted_intent());

        notifyCustomerUnit(conversation, saved, customer.fullName(), transcript, analysis);
        return new IngestResult(conversation, saved, analysis);
    }

    /**
     * Rejected when the conversation is closed or held by another agent. Unassigned conversations accept any agent.
     */
    public IngestResult sendAgentReply(String conversationId, String agentId, String agentName, String text) {
        var conversation = conversationRepository.findById(conversationId)
                .orElseThrow(() -> new NotFoundException("conversation_not_found"));
        if (!conversation.isOpen()) {
            throw new ConflictException("conversation_closed");
        }
        if (conversation.assignedAgentId() != null && !conversation.assignedAgentId().equals(agentId)) {
            var details = new LinkedHashMap<String, Object>();
            details.put("assigned_agent_id", conversation.assignedAgentId());
            details.put("assigned_agent_name", conversation.assignedAgentName());
            throw new ConflictException("conversation_assigned_to_other_agent", details);
        }

        var saved = messageRepository.save(new MessageRepository.NewMessage(
                conversationId, MessageRepository.SENDER_AGENT, agentId, agentName, text, null, null, null));
        log.info("agent_message_saved conversation_id={} message_id={} agent_id={}", conversationId, saved.id(), agentId);

        router.deliver(router.resolveForAgentMessage(conversationId), new Notification.AgentChatMessage(
                conversationId,
                saved.id(),
                MessageRepository.SENDER_AGENT,
                agentId,
                agentName,
                text,
                saved.createdAt()
        ));
        return new IngestResult(conversation, saved, null);
    }

    private void notifyCustomerUnit(
            ConversationRepository.ConversationRow conversation,
            MessageRepository.MessageRow saved,
            String customerName,
            String originalMessage,
            AnalysisResult analysis
    ) {
        var imageUrl = saved.mediaRef() != null && saved.mediaRef().startsWith("data:") ? saved.mediaRef() : null;
        var ocrText = imageUrl == null ? null : saved.extractedText();
        router.deliver(router.resolveForCustomerMessage(conversation), new Notification.CustomerMessageAnalysis(
                conversation.id(),
                saved.id(),
                saved.senderId(),
                customerName,
                conversation.source(),
                originalMessage,
                imageUrl,
                ocrText,
                analysis,
                saved.createdAt()
        ));
        router.deliver(router.resolveForCustomerEcho(conversation), new Notification.CustomerChatMessage(
                conversation.id(),
                saved.id(),
                MessageRepository.SENDER_CUSTOMER,
                saved.text(),
                imageUrl,
                ocrText,
                saved.createdAt()
        ));
    }

    private List<AnalysisRequest.ConversationTurn> historyOf(String conversationId) {
        var rows = messageRepository.listByConversation(conversationId);
        var out = new ArrayList<AnalysisRequest.ConversationTurn>(rows.size());
        for (var r : rows) {
            out.add(new AnalysisRequest.ConversationTurn(r.sender(), r.text()));
        }
        return out;
    }

    static String toDataUrl(byte[] bytes, String contentType) {
        var ct = contentType == null || contentType.isBlank() ? "image/jpeg" : contentType;
        return "data:" + ct + ";base64," + Base64.getEncoder().encodeToString(bytes);
    }
}
