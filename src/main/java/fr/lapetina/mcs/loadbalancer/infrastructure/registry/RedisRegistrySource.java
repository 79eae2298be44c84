package fr.lapetina.mcs.loadbalancer.infrastructure.registry;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.Range;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanIterator;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Registry source reading the chat server heartbeats from Redis with Lettuce.
 *
 * The connection is opened on first use and dropped after any Redis error, so the
 * next poll reconnects. Every command is bounded by the configured timeout.
 */
public final class RedisRegistrySource implements RegistrySource {

    private static final Logger log = LoggerFactory.getLogger(RedisRegistrySource.class);

    private static final int SCAN_COUNT = 100;

    private final RedisClient client;
    private final RedisURI redisUri;
    private final RegistryMode mode;
    private final String key;
    private final String keyPattern;
    private final Duration heartbeatTtl;
    private final Clock clock;

    private StatefulRedisConnection<String, String> connection;

    public RedisRegistrySource(
            String redisUrl,
            RegistryMode mode,
            String key,
            String keyPattern,
            Duration heartbeatTtl,
            Duration commandTimeout,
            Clock clock
    ) {
        this.redisUri = RedisURI.create(redisUrl);
        this.redisUri.setTimeout(commandTimeout);
        this.mode = mode;
        this.key = key;
        this.keyPattern = keyPattern;
        this.heartbeatTtl = heartbeatTtl;
        this.clock = clock;
        this.client = RedisClient.create(redisUri);
        this.client.setOptions(ClientOptions.builder()
                .socketOptions(SocketOptions.builder().connectTimeout(commandTimeout).build())
                .timeoutOptions(TimeoutOptions.enabled(commandTimeout))
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .build());
    }

    @Override
    public synchronized RegistrySnapshot fetch() {
        Instant now = clock.instant();
        try {
            RedisCommands<String, String> commands = commands();
            Set<String> addresses = switch (mode) {
                case SORTED_SET -> fetchSortedSet(commands, now);
                case KEY_PATTERN -> fetchKeyPattern(commands);
            };
            return new RegistrySnapshot(addresses, now);
        } catch (RedisException e) {
            closeConnection();
            throw new RegistryUnavailableException("Registry query failed on " + describe() + ": " + e.getMessage(), e);
        }
    }

    private Set<String> fetchSortedSet(RedisCommands<String, String> commands, Instant now) {
        // Members whose heartbeat is strictly newer than now - ttl
        long minScore = now.minus(heartbeatTtl).getEpochSecond();
        List<String> members = commands.zrangebyscore(key,
                Range.from(Range.Boundary.excluding(minScore), Range.Boundary.unbounded()));
        return new HashSet<>(members);
    }

    private Set<String> fetchKeyPattern(RedisCommands<String, String> commands) {
        String prefix = keyPattern.endsWith("*") ? keyPattern.substring(0, keyPattern.length() - 1) : keyPattern;
        Set<String> addresses = new HashSet<>();
        ScanIterator<String> keys = ScanIterator.scan(commands, ScanArgs.Builder.matches(keyPattern).limit(SCAN_COUNT));
        while (keys.hasNext()) {
            String found = keys.next();
            if (found.startsWith(prefix) && found.length() > prefix.length()) {
                addresses.add(found.substring(prefix.length()));
            }
        }
        return addresses;
    }

    private RedisCommands<String, String> commands() {
        if (connection == null || !connection.isOpen()) {
            log.debug("Connecting to registry: {}", describe());
            connection = client.connect();
            log.info("Connected to registry: {}", describe());
        }
        return connection.sync();
    }

    private void closeConnection() {
        if (connection != null) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.debug("Error closing registry connection: {}", e.toString());
            }
            connection = null;
        }
    }

    @Override
    public String describe() {
        String target = mode == RegistryMode.SORTED_SET ? key : keyPattern;
        return "redis://" + redisUri.getHost() + ":" + redisUri.getPort() + " " + mode.getConfigName() + " " + target;
    }

    @Override
    public synchronized void close() {
        closeConnection();
        client.shutdown();
        log.info("Registry connection closed");
    }
}
