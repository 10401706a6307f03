package io.kurrent.client.examples;

import io.kurrent.client.KurrentClient;
import io.kurrent.client.Result;
import io.kurrent.client.Success;
import io.kurrent.client.model.LogPosition;
import io.kurrent.client.persistent.ConsumerStrategy;
import io.kurrent.client.persistent.NackAction;
import io.kurrent.client.persistent.PersistentSubscription;
import io.kurrent.client.persistent.PersistentSubscriptionError;
import io.kurrent.client.persistent.PersistentSubscriptionSettings;
import io.kurrent.client.persistent.SubscriptionDroppedReason;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Example demonstrating a callback-driven persistent subscription.
 *
 * <p>This example creates a subscription group on a stream if it does not exist yet, then
 * subscribes to it with a record handler. The handler acknowledges every record it processes
 * and parks the ones it cannot handle. The example stops after a fixed number of records or
 * when the subscription is dropped.
 *
 * <p><b>Use Case:</b> Best for long running consumers where the client drives delivery and
 * the application only reacts to records.
 */
public class CallbackSubscriptionExample {

    // Configuration - update these with your values
    private static final String SERVER_ENDPOINT = "localhost:2113";
    private static final String USERNAME = "admin";
    private static final String PASSWORD = "changeit";
    private static final String STREAM_NAME = "orders-1";
    private static final String GROUP_NAME = "billing";

    // Number of records to process before closing
    private static final int NUM_RECORDS = 100;

    public static void main(String[] args) throws Exception {
        System.out.println("Starting callback subscription example...");
        System.out.println("=========================================");

        try (KurrentClient client = KurrentClient.builder(SERVER_ENDPOINT)
                .credentials(USERNAME, PASSWORD)
                .build()) {
            System.out.println("✓ Client initialized");

            // Step 1: Make sure the group exists
            PersistentSubscriptionSettings settings = PersistentSubscriptionSettings.builder()
                .setStartFrom(LogPosition.earliest())
                .setMaxRetryCount(5)
                .setConsumerStrategy(ConsumerStrategy.ROUND_ROBIN)
                .build();
            Result<Success, PersistentSubscriptionError> created = client
                .persistentSubscriptions()
                .createToStream(STREAM_NAME, GROUP_NAME, settings)
                .get(10, TimeUnit.SECONDS);
            if (created.isSuccess()) {
                System.out.println("✓ Subscription group created");
            } else {
                System.out.println("• " + created.getError().getMessage());
            }

            // Step 2: Subscribe with a handler
            AtomicInteger processed = new AtomicInteger();
            CountDownLatch done = new CountDownLatch(1);

            Result<PersistentSubscription, PersistentSubscriptionError> result = client
                .persistentSubscriptions()
                .subscribeToStream(
                    STREAM_NAME,
                    GROUP_NAME,
                    (subscription, record, retryCount, cancellation) -> {
                        if (record.getData().length == 0) {
                            subscription.nack(NackAction.PARK, "empty payload", record);
                        } else {
                            subscription.ack(record);
                        }
                        if (processed.incrementAndGet() >= NUM_RECORDS) {
                            done.countDown();
                        }
                    },
                    (subscription, reason, error) -> {
                        if (reason != SubscriptionDroppedReason.DISPOSED) {
                            System.err.println("✗ Subscription dropped: " + reason + " " + error);
                        }
                        done.countDown();
                    })
                .get(10, TimeUnit.SECONDS);

            if (result.isFailure()) {
                System.err.println("✗ Failed to subscribe: " + result.getError().getMessage());
                System.exit(1);
            }

            // Step 3: Wait, then close the subscription
            try (PersistentSubscription subscription = result.getValue()) {
                System.out.println("✓ Subscribed: " + subscription.getSubscriptionId());
                done.await(60, TimeUnit.SECONDS);
            }

            System.out.println("\n=========================================");
            System.out.println("Processed records: " + processed.get());
            System.out.println("=========================================");
        }

        System.out.println("\nCallback subscription example completed successfully!");
    }
}
