package io.kurrent.client.examples;

import io.kurrent.client.KurrentClient;
import io.kurrent.client.Result;
import io.kurrent.client.model.Record;
import io.kurrent.client.persistent.PersistentSubscriptionError;
import io.kurrent.client.persistent.PersistentSubscriptionInfo;
import io.kurrent.client.persistent.PersistentSubscriptionResult;
import io.kurrent.client.persistent.SubscriptionMessage;

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Example demonstrating a pull-based persistent subscription to the all-stream.
 *
 * <p>The application enumerates the messages of the subscription itself and acknowledges
 * records as it goes. The server never runs more than one message ahead of the reader.
 *
 * <p><b>Use Case:</b> Best when the consumer controls its own pace, for example when records
 * are processed in batches.
 */
public class PullSubscriptionExample {

    // Configuration - update these with your values
    private static final String SERVER_ENDPOINT = "localhost:2113";
    private static final String USERNAME = "admin";
    private static final String PASSWORD = "changeit";
    private static final String GROUP_NAME = "audit";

    private static final int NUM_RECORDS = 1_000;

    public static void main(String[] args) throws Exception {
        System.out.println("Starting pull subscription example...");
        System.out.println("=====================================");

        try (KurrentClient client = KurrentClient.builder(SERVER_ENDPOINT)
                .credentials(USERNAME, PASSWORD)
                .build()) {

            // Step 1: Show the groups on the all-stream
            Result<List<PersistentSubscriptionInfo>, PersistentSubscriptionError> groups =
                client.persistentSubscriptions().listToAll().get(10, TimeUnit.SECONDS);
            if (groups.isSuccess()) {
                for (PersistentSubscriptionInfo info : groups.getValue()) {
                    System.out.println("• " + info.getGroupName() + " (" + info.getStatus() + ")");
                }
            }

            // Step 2: Open the subscription
            Result<PersistentSubscriptionResult, PersistentSubscriptionError> result =
                client.persistentSubscriptions().subscribeToAll(GROUP_NAME).get(10, TimeUnit.SECONDS);
            if (result.isFailure()) {
                System.err.println("✗ Failed to subscribe: " + result.getError().getMessage());
                System.exit(1);
            }

            // Step 3: Pull messages until enough records were processed
            int processed = 0;
            long startTime = System.currentTimeMillis();
            try (PersistentSubscriptionResult subscription = result.getValue()) {
                Iterator<SubscriptionMessage> messages = subscription.messages();
                while (processed < NUM_RECORDS && messages.hasNext()) {
                    SubscriptionMessage message = messages.next();
                    switch (message.getKind()) {
                        case CONFIRMATION:
                            System.out.println("✓ Subscribed: " + subscription.getSubscriptionId().get());
                            break;
                        case EVENT:
                            Record record = ((SubscriptionMessage.Event) message).getRecord();
                            subscription.ack(record);
                            processed++;
                            break;
                        case NOT_FOUND:
                            System.err.println("✗ Group " + GROUP_NAME + " does not exist");
                            return;
                        default:
                            break;
                    }
                }
            }

            double duration = (System.currentTimeMillis() - startTime) / 1000.0;
            System.out.println("\n=====================================");
            System.out.println("Processed records: " + processed);
            System.out.println("Time: " + String.format("%.2f", duration) + " seconds");
            System.out.println("=====================================");
        }

        System.out.println("\nPull subscription example completed successfully!");
    }
}
