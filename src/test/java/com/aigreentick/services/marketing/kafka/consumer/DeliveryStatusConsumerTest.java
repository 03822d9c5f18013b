package com.aigreentick.services.marketing.kafka.consumer;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.kafka.support.Acknowledgment;

import com.aigreentick.services.marketing.campaign.enums.ReconcileOutcome;
import com.aigreentick.services.marketing.campaign.service.impl.StatusReconciler;
import com.aigreentick.services.marketing.kafka.event.DeliveryStatusEvent;

@ExtendWith(MockitoExtension.class)
class DeliveryStatusConsumerTest {

    @Mock
    private StatusReconciler statusReconciler;

    @Mock
    private Acknowledgment acknowledgment;

    @InjectMocks
    private DeliveryStatusConsumer consumer;

    private final DeliveryStatusEvent event = DeliveryStatusEvent.builder()
            .providerMessageId("wamid.abc")
            .eventType("delivered")
            .timestamp(1748768400L)
            .build();

    @Test
    void acknowledgesAfterReconciling() {
        when(statusReconciler.reconcile(event)).thenReturn(ReconcileOutcome.APPLIED);

        consumer.consumeDeliveryStatus(event, 0, 42L, acknowledgment);

        verify(acknowledgment).acknowledge();
    }

    @Test
    void heldEventsAreAcknowledgedToo() {
        when(statusReconciler.reconcile(event)).thenReturn(ReconcileOutcome.HELD);

        consumer.consumeDeliveryStatus(event, 0, 43L, acknowledgment);

        verify(acknowledgment).acknowledge();
    }

    @Test
    void malformedEventIsSkipped() {
        when(statusReconciler.reconcile(event)).thenThrow(new IllegalArgumentException("Unknown delivery event type: bounced"));

        consumer.consumeDeliveryStatus(event, 1, 7L, acknowledgment);

        verify(acknowledgment).acknowledge();
        verify(acknowledgment, never()).nack(DeliveryStatusConsumer.REDELIVERY_DELAY);
    }

    @Test
    void storageFailureIsRedelivered() {
        when(statusReconciler.reconcile(event)).thenThrow(new QueryTimeoutException("lock wait timeout"));

        consumer.consumeDeliveryStatus(event, 1, 8L, acknowledgment);

        verify(acknowledgment).nack(DeliveryStatusConsumer.REDELIVERY_DELAY);
        verify(acknowledgment, never()).acknowledge();
    }
}
