package com.easycashflows.service.dispatch;

import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.DispatchStatus;
import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.message.OutboundResponse;
import com.easycashflows.domain.model.OutboundMessageLog;
import com.easycashflows.repository.OutboundMessageLogRepository;
import com.easycashflows.util.WebhookText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Single entry point for outbound messages. Picks the sender registered for the
 * (provider, channel) pair, never throws, and records every attempt in the outbound log.
 */
@Slf4j
@Service
public class DispatchService {

    private final List<OutboundSender> senders;
    private final OutboundMessageLogRepository outboundMessageLogRepository;
    private final Executor webhookDispatchExecutor;

    @Autowired
    public DispatchService(List<OutboundSender> senders,
                           OutboundMessageLogRepository outboundMessageLogRepository,
                           @Qualifier("webhookDispatchExecutor") Executor webhookDispatchExecutor) {
        this.senders = senders;
        this.outboundMessageLogRepository = outboundMessageLogRepository;
        this.webhookDispatchExecutor = webhookDispatchExecutor;
    }

    public DispatchResult send(Provider provider, Channel channel, String recipient, String text) {
        return send(provider, channel, recipient, text, null, null);
    }

    public DispatchResult send(OutboundResponse response) {
        return send(response.provider(), response.channel(), response.recipient(), response.text(),
                null, response.sourceMessageId());
    }

    public CompletableFuture<DispatchResult> sendAsync(OutboundResponse response) {
        return submit(() -> send(response));
    }

    /**
     * Sends the same text to every recipient concurrently. One slow or failing recipient
     * does not affect the others; results come back in recipient order.
     */
    public List<DispatchResult> sendAll(Provider provider, Channel channel, List<String> recipients,
                                        String text, UUID ruleId) {
        List<CompletableFuture<DispatchResult>> futures = recipients.stream()
                .map(recipient -> submit(() -> send(provider, channel, recipient, text, ruleId, null)))
                .toList();
        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    DispatchResult send(Provider provider, Channel channel, String recipient, String text,
                        UUID ruleId, String sourceMessageId) {
        DispatchResult result = deliver(provider, channel, recipient, text);
        if (result.isSuccess()) {
            log.info("Outbound message sent. provider={}, channel={}, to={}, providerMessageId={}",
                    provider.id(), channel.id(), WebhookText.mask(recipient), result.messageId());
        } else {
            log.warn("Outbound message not sent. provider={}, channel={}, to={}, status={}, error={}",
                    provider.id(), channel.id(), WebhookText.mask(recipient), result.status(), result.error());
        }
        record(provider, channel, recipient, ruleId, sourceMessageId, result);
        return result;
    }

    private DispatchResult deliver(Provider provider, Channel channel, String recipient, String text) {
        if (!WebhookText.hasText(recipient)) {
            return DispatchResult.failed("Recipient is empty");
        }
        OutboundSender sender = senders.stream()
                .filter(s -> s.provider() == provider && s.supports(channel))
                .findFirst()
                .orElse(null);
        if (sender == null) {
            return DispatchResult.unsupported(channel.id() + " via " + provider.id() + " is not yet supported");
        }
        try {
            return sender.send(channel, recipient, text);
        } catch (ProviderOperationNotSupportedException e) {
            return DispatchResult.unsupported(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Sender {} failed unexpectedly", provider.id(), e);
            return DispatchResult.failed(e.getMessage());
        }
    }

    private CompletableFuture<DispatchResult> submit(Supplier<DispatchResult> task) {
        try {
            return CompletableFuture.supplyAsync(task, webhookDispatchExecutor)
                    .exceptionally(ex -> DispatchResult.failed(ex.getMessage()));
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch queue is full, dropping send: {}", e.getMessage());
            return CompletableFuture.completedFuture(DispatchResult.failed("Dispatch queue is full"));
        }
    }

    private void record(Provider provider, Channel channel, String recipient, UUID ruleId,
                        String sourceMessageId, DispatchResult result) {
        OutboundMessageLog entry = new OutboundMessageLog();
        entry.setProvider(provider);
        entry.setChannel(channel);
        entry.setRecipient(recipient == null ? "" : recipient);
        entry.setRuleId(ruleId);
        entry.setSourceMessageId(sourceMessageId);
        entry.setProviderMessageId(result.messageId());
        entry.setDispatchStatus(result.status());
        entry.setDeliveryStatus(result.status() == DispatchStatus.SENT ? "queued" : null);
        entry.setErrorMessage(result.error());
        try {
            outboundMessageLogRepository.save(entry);
        } catch (DataAccessException e) {
            log.error("Failed to record outbound message. provider={}, status={}", provider.id(), result.status(), e);
        }
    }
}
