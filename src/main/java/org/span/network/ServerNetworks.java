package org.span.network;

import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Generators for common server network shapes. Server ids are {@code 0..n-1}.
 */
@UtilityClass
public final class ServerNetworks {

    /**
     * Builds a path {@code 0 - 1 - ... - n-1}.
     *
     * @param capacities per-server capacity, one entry per server.
     */
    public static ServerNetwork line(int... capacities) {
        Objects.requireNonNull(capacities, "capacities");
        ServerNetwork.Builder builder = ServerNetwork.builder();
        for (int server = 0; server < capacities.length; server++) {
            builder.server(server, capacities[server]);
            if (server > 0) {
                builder.link(server - 1, server);
            }
        }
        return builder.build();
    }

    /**
     * Builds an all-to-all network where every server has the same capacity.
     */
    public static ServerNetwork complete(int serverCount, int capacity) {
        if (serverCount <= 0) {
            throw new IllegalArgumentException("serverCount must be > 0");
        }
        ServerNetwork.Builder builder = ServerNetwork.builder();
        for (int server = 0; server < serverCount; server++) {
            builder.server(server, capacity);
            for (int other = 0; other < server; other++) {
                builder.link(other, server);
            }
        }
        return builder.build();
    }

    /**
     * Builds a random connected network.
     * <p>
     * Server {@code i > 0} is first linked to a uniformly chosen server below it,
     * which guarantees connectivity; every other pair is then linked with
     * probability {@code edgeProbability}. Each server receives one unit of
     * capacity and the remainder is spread uniformly.
     *
     * @param serverCount number of servers, {@code > 0}.
     * @param totalCapacity total capacity, {@code >= serverCount}.
     * @param edgeProbability extra-link probability in {@code [0, 1]}.
     * @param random source of randomness.
     */
    public static ServerNetwork randomConnected(
            int serverCount,
            int totalCapacity,
            double edgeProbability,
            SplittableRandom random
    ) {
        Objects.requireNonNull(random, "random");
        if (serverCount <= 0) {
            throw new IllegalArgumentException("serverCount must be > 0");
        }
        if (totalCapacity < serverCount) {
            throw new IllegalArgumentException(
                    "totalCapacity must be >= serverCount, got " + totalCapacity + " < " + serverCount);
        }
        if (!(edgeProbability >= 0.0d && edgeProbability <= 1.0d)) {
            throw new IllegalArgumentException("edgeProbability must be in [0, 1], got " + edgeProbability);
        }

        int[] capacities = new int[serverCount];
        Arrays.fill(capacities, 1);
        for (int unit = serverCount; unit < totalCapacity; unit++) {
            capacities[random.nextInt(serverCount)]++;
        }

        ServerNetwork.Builder builder = ServerNetwork.builder();
        for (int server = 0; server < serverCount; server++) {
            builder.server(server, capacities[server]);
        }
        for (int server = 1; server < serverCount; server++) {
            builder.link(random.nextInt(server), server);
        }
        for (int a = 0; a < serverCount; a++) {
            for (int b = a + 1; b < serverCount; b++) {
                if (random.nextDouble() < edgeProbability) {
                    builder.link(a, b);
                }
            }
        }
        return builder.build();
    }
}
