package com.aporkolab.reliability.spring.autoconfigure;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.reliability.connection.ConnectionManager;
import com.aporkolab.reliability.consumer.MessageConsumer;
import com.aporkolab.reliability.consumer.MessageHandler;
import com.aporkolab.reliability.dlq.DeadLetterQueueHandler;
import com.aporkolab.reliability.dlq.DlqListener;
import com.aporkolab.reliability.publisher.MessagePublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;

/**
 * Creates consumers and publishers on the managed channel.
 *
 * Subscriptions are remembered and rebuilt on the new channel after each
 * background reconnection. Publishers are bound to the channel current at
 * creation and must be recreated by the caller.
 */
public class ReliableConsumerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReliableConsumerFactory.class);

    private final ConnectionManager connectionManager;
    private final ReliabilityProperties properties;
    private final ObjectMapper objectMapper;
    private final DlqListener dlqListener;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public ReliableConsumerFactory(ConnectionManager connectionManager, ReliabilityProperties properties,
                                   ObjectMapper objectMapper, DlqListener dlqListener) {
        this.connectionManager = connectionManager;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.dlqListener = dlqListener;
        connectionManager.onReconnected(this::resubscribeAll);
    }

    /**
     * Declares the topology, sets up retry and DLQ routing and starts consuming.
     * Connects first if the manager is not connected yet.
     */
    public synchronized MessageConsumer subscribe(String exchange, String queue, String routingKey,
                                                  MessageHandler handler) throws IOException {
        Subscription subscription = new Subscription(exchange, queue, routingKey, handler);
        start(subscription);
        subscriptions.add(subscription);
        return subscription.consumer;
    }

    public MessagePublisher publisher(String exchange) {
        return new MessagePublisher(channel(), exchange, objectMapper);
    }

    public List<MessageConsumer> getConsumers() {
        return subscriptions.stream()
                .map(subscription -> subscription.consumer)
                .toList();
    }

    synchronized void resubscribeAll() {
        log.info("Resubscribing consumers after reconnection: count={}", subscriptions.size());
        for (Subscription subscription : subscriptions) {
            try {
                start(subscription);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to resubscribe consumer: queue={}, error={}",
                        subscription.queue, e.getMessage(), e);
            }
        }
    }

    private void start(Subscription subscription) throws IOException {
        Channel channel = channel();

        DeadLetterQueueHandler dlqHandler = DeadLetterQueueHandler.builder()
                .channel(channel)
                .exchange(subscription.exchange)
                .queue(subscription.queue)
                .serviceName(properties.getDlq().getServiceName())
                .maxRetries(properties.getDlq().getMaxRetries())
                .objectMapper(objectMapper)
                .listener(dlqListener)
                .build();

        MessageConsumer consumer = MessageConsumer.builder()
                .channel(channel)
                .exchange(subscription.exchange)
                .queue(subscription.queue)
                .routingKey(subscription.routingKey)
                .dlqHandler(dlqHandler)
                .handler(subscription.handler)
                .prefetchCount(properties.getConsumer().getPrefetchCount())
                .objectMapper(objectMapper)
                .build();

        consumer.start();
        subscription.consumer = consumer;
    }

    private Channel channel() {
        if (!connectionManager.isConnected()) {
            connectionManager.connect();
        }
        return connectionManager.getChannel();
    }

    /**
     * Cancels every subscription. The connection itself is closed by its own bean.
     */
    @Override
    public synchronized void close() {
        for (Subscription subscription : subscriptions) {
            MessageConsumer consumer = subscription.consumer;
            if (consumer == null || !consumer.isConsuming()) {
                continue;
            }
            try {
                consumer.stop();
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to stop consumer: queue={}, error={}", subscription.queue, e.getMessage());
            }
        }
        subscriptions.clear();
    }

    private static class Subscription {
        private final String exchange;
        private final String queue;
        private final String routingKey;
        private final MessageHandler handler;
        private volatile MessageConsumer consumer;

        Subscription(String exchange, String queue, String routingKey, MessageHandler handler) {
            this.exchange = exchange;
            this.queue = queue;
            this.routingKey = routingKey;
            this.handler = handler;
        }
    }
}
