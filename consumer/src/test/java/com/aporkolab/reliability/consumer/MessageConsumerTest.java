package com.aporkolab.reliability.consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import com.aporkolab.reliability.dlq.DeadLetterQueueHandler;
import com.aporkolab.reliability.dlq.DlqHandler;
import com.aporkolab.reliability.exception.ConfigurationException;
import com.aporkolab.reliability.exception.NonRetryableException;
import com.aporkolab.reliability.exception.RetryableException;
import com.aporkolab.reliability.logging.LogContext;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;

@ExtendWith(MockitoExtension.class)
class MessageConsumerTest {

    @Mock
    private Channel channel;

    @Mock
    private DlqHandler dlqHandler;

    private MessageHandler handler;
    private MessageConsumer consumer;

    @BeforeEach
    void setUp() {
        handler = (content, message) -> {
        };
    }

    private MessageConsumer consumerWith(MessageHandler messageHandler) {
        return MessageConsumer.builder()
                .channel(channel)
                .exchange("orders")
                .queue("orders.created")
                .routingKey("order.created.*")
                .dlqHandler(dlqHandler)
                .handler(messageHandler)
                .build();
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should assert topology, set up DLQ, then consume with manual ack")
        void shouldStartInOrder() throws Exception {
            when(channel.basicConsume(eq("orders.created"), eq(false), any(DeliverCallback.class), any(CancelCallback.class)))
                    .thenReturn("ctag-1");
            consumer = consumerWith(handler);

            consumer.start();

            InOrder order = inOrder(channel, dlqHandler);
            order.verify(channel).basicQos(10);
            order.verify(channel).exchangeDeclare("orders", BuiltinExchangeType.TOPIC, true);
            order.verify(channel).queueDeclare("orders.created", true, false, false, null);
            order.verify(channel).queueBind("orders.created", "orders", "order.created.*");
            order.verify(dlqHandler).setup();
            order.verify(channel).basicConsume(eq("orders.created"), eq(false), any(DeliverCallback.class), any(CancelCallback.class));
            assertThat(consumer.isConsuming()).isTrue();
        }

        @Test
        @DisplayName("should cancel subscription on stop")
        void shouldCancelOnStop() throws Exception {
            when(channel.basicConsume(eq("orders.created"), eq(false), any(DeliverCallback.class), any(CancelCallback.class)))
                    .thenReturn("ctag-1");
            consumer = consumerWith(handler);
            consumer.start();

            consumer.stop();
            consumer.stop();

            verify(channel).basicCancel("ctag-1");
            assertThat(consumer.isConsuming()).isFalse();
        }

        @Test
        @DisplayName("should not cancel when never started")
        void shouldIgnoreStopBeforeStart() throws Exception {
            consumerWith(handler).stop();

            verify(channel, never()).basicCancel(anyString());
        }

        @Test
        @DisplayName("should dispatch broker deliveries and clear tag on broker cancellation")
        void shouldWireCallbacks() throws Exception {
            ArgumentCaptor<DeliverCallback> deliver = ArgumentCaptor.forClass(DeliverCallback.class);
            ArgumentCaptor<CancelCallback> cancel = ArgumentCaptor.forClass(CancelCallback.class);
            when(channel.basicConsume(eq("orders.created"), eq(false), deliver.capture(), cancel.capture()))
                    .thenReturn("ctag-1");
            consumer = consumerWith(handler);
            consumer.start();

            deliver.getValue().handle("ctag-1", delivery(4L, null, "{\"id\":1}"));
            cancel.getValue().handle("ctag-1");

            verify(channel).basicAck(4L, false);
            assertThat(consumer.isConsuming()).isFalse();
        }

        @Test
        @DisplayName("should propagate DLQ setup failure")
        void shouldPropagateSetupFailure() throws Exception {
            doThrow(new IOException("NOT_FOUND")).when(dlqHandler).setup();
            consumer = consumerWith(handler);

            assertThatThrownBy(consumer::start).isInstanceOf(IOException.class);
            verify(channel, never()).basicConsume(anyString(), anyBoolean(), any(DeliverCallback.class), any(CancelCallback.class));
        }
    }

    @Nested
    @DisplayName("Delivery Handling")
    class DeliveryHandling {

        @Test
        @DisplayName("should ack exactly once after successful handling")
        void shouldAckOnSuccess() throws Exception {
            AtomicReference<Map<String, Object>> received = new AtomicReference<>();
            consumer = consumerWith((content, message) -> received.set(content));

            consumer.handleDelivery(delivery(1L, null, "{\"orderId\":42,\"status\":\"NEW\"}"));

            assertThat(received.get()).containsEntry("orderId", 42).containsEntry("status", "NEW");
            verify(channel).basicAck(1L, false);
            verifyNoInteractions(dlqHandler);
        }

        @Test
        @DisplayName("should ignore null delivery")
        void shouldIgnoreNullDelivery() {
            consumer = consumerWith(handler);

            consumer.handleDelivery(null);

            verifyNoInteractions(channel, dlqHandler);
        }

        @Test
        @DisplayName("should route non-retryable failures to the non-retryable path")
        void shouldRouteNonRetryable() throws Exception {
            NonRetryableException failure = new NonRetryableException("invalid order");
            consumer = consumerWith((content, message) -> {
                throw failure;
            });
            Delivery message = delivery(2L, null, "{}");

            consumer.handleDelivery(message);

            verify(dlqHandler).handleNonRetryableError(message, failure);
            verify(dlqHandler, never()).handleRetryableError(any(), any());
            verify(channel, never()).basicAck(anyLong(), anyBoolean());
        }

        @Test
        @DisplayName("should route any other failure to the retryable path")
        void shouldRouteRetryable() throws Exception {
            IllegalStateException failure = new IllegalStateException("db timeout");
            consumer = consumerWith((content, message) -> {
                throw failure;
            });
            Delivery message = delivery(3L, Map.of("x-retry-count", 3), "{}");

            consumer.handleDelivery(message);

            verify(dlqHandler).handleRetryableError(message, failure);
            verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
        }

        @Test
        @DisplayName("should treat undecodable bodies as retryable decode errors")
        void shouldRetryDecodeFailures() throws Exception {
            consumer = consumerWith((content, message) -> {
                throw new AssertionError("handler must not run");
            });

            consumer.handleDelivery(delivery(5L, null, "not json"));
            consumer.handleDelivery(delivery(6L, null, "null"));
            consumer.handleDelivery(delivery(7L, null, "[1,2]"));

            ArgumentCaptor<Exception> errors = ArgumentCaptor.forClass(Exception.class);
            verify(dlqHandler, org.mockito.Mockito.times(3)).handleRetryableError(any(Delivery.class), errors.capture());
            assertThat(errors.getAllValues()).allSatisfy(error -> {
                assertThat(error).isInstanceOf(RetryableException.class);
                assertThat(((RetryableException) error).getCode()).isEqualTo("DECODE_ERROR");
            });
        }

        @Test
        @DisplayName("should reject bodies with trailing content after the JSON object")
        void shouldRejectTrailingTokens() throws Exception {
            consumer = consumerWith((content, message) -> {
                throw new AssertionError("handler must not run");
            });

            consumer.handleDelivery(delivery(8L, null, "{\"a\":1} garbage"));

            ArgumentCaptor<Exception> error = ArgumentCaptor.forClass(Exception.class);
            verify(dlqHandler).handleRetryableError(any(Delivery.class), error.capture());
            assertThat(error.getValue()).isInstanceOf(RetryableException.class);
            assertThat(((RetryableException) error.getValue()).getCode()).isEqualTo("DECODE_ERROR");
        }

        @Test
        @DisplayName("should expose correlation id and queue to handler via MDC")
        void shouldScopeLogContext() {
            AtomicReference<String> correlationId = new AtomicReference<>();
            AtomicReference<String> queue = new AtomicReference<>();
            consumer = consumerWith((content, message) -> {
                correlationId.set(MDC.get(LogContext.CORRELATION_ID_KEY));
                queue.set(MDC.get(LogContext.QUEUE_KEY));
            });
            AMQP.BasicProperties props = new AMQP.BasicProperties.Builder().correlationId("corr-123").build();

            consumer.handleDelivery(new Delivery(new Envelope(8L, false, "orders", "order.created"), props,
                    "{}".getBytes(StandardCharsets.UTF_8)));

            assertThat(correlationId.get()).isEqualTo("corr-123");
            assertThat(queue.get()).isEqualTo("orders.created");
            assertThat(MDC.get(LogContext.CORRELATION_ID_KEY)).isNull();
        }
    }

    @Nested
    @DisplayName("DLQ Failures")
    class DlqFailures {

        @Test
        @DisplayName("should nack without requeue when DLQ publish fails")
        void shouldNackWhenDlqFails() throws Exception {
            consumer = consumerWith((content, message) -> {
                throw new IllegalStateException("db timeout");
            });
            doThrow(new IOException("channel closed")).when(dlqHandler).handleRetryableError(any(), any());

            consumer.handleDelivery(delivery(9L, null, "{}"));

            verify(channel).basicNack(9L, false, false);
            verify(channel, never()).basicAck(anyLong(), anyBoolean());
            assertThat(consumer.getDroppedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should survive a failing nack")
        void shouldSurviveFailingNack() throws Exception {
            consumer = consumerWith((content, message) -> {
                throw new NonRetryableException("bad");
            });
            doThrow(new IOException("channel closed")).when(dlqHandler).handleNonRetryableError(any(), any());
            doThrow(new IOException("channel closed")).when(channel).basicNack(anyLong(), anyBoolean(), anyBoolean());

            consumer.handleDelivery(delivery(10L, null, "{}"));

            assertThat(consumer.getDroppedCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("With Dead Letter Queue Handler")
    class WithDeadLetterQueueHandler {

        @Test
        @DisplayName("should ack original exactly once after scheduling retry")
        void shouldAckOnceAfterRetry() throws Exception {
            DlqHandler realHandler = DeadLetterQueueHandler.builder()
                    .channel(channel)
                    .exchange("orders")
                    .queue("orders.created")
                    .serviceName("orders")
                    .build();
            consumer = MessageConsumer.builder()
                    .channel(channel)
                    .exchange("orders")
                    .queue("orders.created")
                    .routingKey("order.created.*")
                    .dlqHandler(realHandler)
                    .handler((content, message) -> {
                        throw new IllegalStateException("db timeout");
                    })
                    .build();

            consumer.handleDelivery(delivery(11L, Map.of("x-retry-count", 3), "{}"));

            ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
            verify(channel).basicPublish(eq("orders.delay"), eq("order.created"), props.capture(), any(byte[].class));
            assertThat(props.getValue().getHeaders()).containsEntry("x-delay", 4000).containsEntry("x-retry-count", 4);
            verify(channel).basicAck(11L, false);
            verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
        }
    }

    @Nested
    @DisplayName("Builder Validation")
    class BuilderValidation {

        @Test
        @DisplayName("should reject prefetch below one")
        void shouldRejectPrefetch() {
            assertThatThrownBy(() -> MessageConsumer.builder().prefetchCount(0))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should require a handler")
        void shouldRequireHandler() {
            assertThatThrownBy(() -> MessageConsumer.builder()
                    .channel(channel).exchange("orders").queue("q").routingKey("#").dlqHandler(dlqHandler).build())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("handler");
        }

        @Test
        @DisplayName("should apply custom prefetch")
        void shouldApplyPrefetch() throws Exception {
            when(channel.basicConsume(anyString(), anyBoolean(), any(DeliverCallback.class), any(CancelCallback.class)))
                    .thenReturn("ctag");
            MessageConsumer custom = MessageConsumer.builder()
                    .channel(channel).exchange("orders").queue("q").routingKey("#")
                    .dlqHandler(dlqHandler).handler(handler).prefetchCount(1).build();

            custom.start();

            verify(channel).basicQos(1);
        }
    }

    // Helper methods
    private Delivery delivery(long tag, Map<String, Object> headers, String body) {
        AMQP.BasicProperties props = new AMQP.BasicProperties.Builder().headers(headers).build();
        return new Delivery(new Envelope(tag, false, "orders", "order.created"), props,
                body.getBytes(StandardCharsets.UTF_8));
    }
}
