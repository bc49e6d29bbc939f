package com.communitychallenge.platform.repository.impl;

import com.communitychallenge.platform.model.RankedContributor;
import com.communitychallenge.platform.repository.LeaderboardCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.resps.Tuple;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis mirror of a challenge leaderboard.
 * Amounts live in a sorted set, first-contribution times in a hash so equal amounts can be tie-broken
 * the same way the database orders them. A running total of the sorted set is kept next to it so
 * readers can tell whether the mirror covers the whole ledger.
 * <p>
 * Scores are doubles: contributor totals above {@link #MAX_EXACT_AMOUNT} are rejected.
 */
@Repository
public class JedisLeaderboardCacheRepository implements LeaderboardCacheRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(JedisLeaderboardCacheRepository.class);
    
    private static final String KEY_PREFIX = "challenge:";
    static final int MAX_WATCH_ATTEMPTS = 3;
    
    private JedisPool jedisPool;
    private volatile boolean available = false;
    
    @Value("${redis.enabled:true}")
    private boolean enabled;
    
    @Value("${redis.host:localhost}")
    private String redisHost;
    
    @Value("${redis.port:6379}")
    private int redisPort;
    
    @Value("${redis.password:}")
    private String redisPassword;
    
    @Value("${redis.ssl:false}")
    private boolean redisSsl;
    
    @Value("${redis.timeout:2000}")
    private int timeout;
    
    @PostConstruct
    public void init() {
        if (!enabled) {
            logger.info("Leaderboard cache disabled, rankings are served from the database");
            return;
        }
        
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(64);
            poolConfig.setMaxIdle(16);
            poolConfig.setMinIdle(4);
            poolConfig.setTestOnBorrow(true);
            
            DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeout)
                .socketTimeoutMillis(timeout);
            
            if (redisSsl) {
                clientConfigBuilder.ssl(true);
            }
            
            if (redisPassword != null && !redisPassword.isEmpty()) {
                clientConfigBuilder.password(redisPassword);
            }
            
            jedisPool = new JedisPool(poolConfig, new HostAndPort(redisHost, redisPort), clientConfigBuilder.build());
            
            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
                available = true;
                logger.info("Connected to Redis at {}:{}{}", redisHost, redisPort, redisSsl ? " (SSL enabled)" : "");
            }
        } catch (Exception e) {
            logger.warn("Failed to initialize Redis connection at {}:{}, error: {}", redisHost, redisPort, e.getMessage());
            available = false;
        }
    }
    
    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }
    
    @Override
    public boolean isEnabled() {
        return enabled;
    }
    
    @Override
    public boolean isAvailable() {
        if (!enabled || jedisPool == null) {
            return false;
        }
        
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            if (!available) {
                logger.info("Redis connection at {}:{} restored", redisHost, redisPort);
            }
            available = true;
            return true;
        } catch (Exception e) {
            if (available) {
                logger.warn("Lost Redis connection at {}:{}: {}", redisHost, redisPort, e.getMessage());
            }
            available = false;
            return false;
        }
    }
    
    @Override
    public void updateContribution(Long challengeId, int generation, String contributorId,
                                   long amountContributed, Instant firstContributedAt) {
        if (challengeId == null) {
            throw new IllegalArgumentException("ChallengeId cannot be null");
        }
        if (contributorId == null || contributorId.trim().isEmpty()) {
            throw new IllegalArgumentException("ContributorId cannot be null or empty");
        }
        if (amountContributed > MAX_EXACT_AMOUNT) {
            throw new IllegalArgumentException("Amount " + amountContributed + " exceeds the exact score range");
        }
        
        if (!isAvailable()) {
            throw new IllegalStateException("Redis is not available");
        }
        
        String key = leaderboardKey(challengeId, generation);
        try (Jedis jedis = jedisPool.getResource()) {
            if (firstContributedAt != null) {
                jedis.hsetnx(firstContributionKey(challengeId, generation), contributorId,
                    String.valueOf(firstContributedAt.toEpochMilli()));
            }
            
            for (int attempt = 1; attempt <= MAX_WATCH_ATTEMPTS; attempt++) {
                jedis.watch(key);
                Double mirrored = jedis.zscore(key, contributorId);
                long previous = mirrored != null ? mirrored.longValue() : 0L;
                // Totals only grow: a smaller total arriving out of order is stale
                if (mirrored != null && previous >= amountContributed) {
                    jedis.unwatch();
                    return;
                }
                
                Transaction transaction = jedis.multi();
                transaction.zadd(key, amountContributed, contributorId);
                transaction.incrBy(totalKey(challengeId, generation), amountContributed - previous);
                if (transaction.exec() != null) {
                    return;
                }
                logger.debug("Leaderboard entry {} of {} changed concurrently, attempt {}", contributorId, key, attempt);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to update leaderboard in Redis", e);
        }
        throw new IllegalStateException("Leaderboard entry " + contributorId + " of " + key
            + " kept changing, giving up after " + MAX_WATCH_ATTEMPTS + " attempts");
    }
    
    @Override
    public List<RankedContributor> getTopN(Long challengeId, int generation, int limit) {
        if (challengeId == null || limit <= 0 || !isAvailable()) {
            return new ArrayList<>();
        }
        
        String key = leaderboardKey(challengeId, generation);
        try (Jedis jedis = jedisPool.getResource()) {
            List<Tuple> tuples = jedis.zrevrangeWithScores(key, 0, limit - 1);
            if (tuples.isEmpty()) {
                return new ArrayList<>();
            }
            
            Map<String, Long> candidates = new LinkedHashMap<>();
            for (Tuple tuple : tuples) {
                candidates.put(tuple.getElement(), (long) tuple.getScore());
            }
            // Members tied with the last entry may rank above it once first-contribution times are compared
            double boundary = tuples.get(tuples.size() - 1).getScore();
            for (String member : jedis.zrangeByScore(key, boundary, boundary)) {
                candidates.putIfAbsent(member, (long) boundary);
            }
            
            List<String> members = new ArrayList<>(candidates.keySet());
            List<String> firstTimes = jedis.hmget(firstContributionKey(challengeId, generation),
                members.toArray(new String[0]));
            
            List<RankedContributor> contributors = new ArrayList<>();
            for (int i = 0; i < members.size(); i++) {
                String firstTime = firstTimes.get(i);
                contributors.add(RankedContributor.builder()
                    .contributorId(members.get(i))
                    .amountContributed(candidates.get(members.get(i)))
                    .firstContributedAt(firstTime != null ? Instant.ofEpochMilli(Long.parseLong(firstTime)) : null)
                    .build());
            }
            contributors.sort(RankedContributor.LEADERBOARD_ORDER);
            
            List<RankedContributor> ranked = new ArrayList<>(contributors.subList(0, Math.min(limit, contributors.size())));
            for (int i = 0; i < ranked.size(); i++) {
                ranked.get(i).setRank(i + 1);
            }
            return ranked;
        } catch (Exception e) {
            logger.warn("Failed to get top {} from Redis for challenge {}: {}", limit, challengeId, e.getMessage());
            return new ArrayList<>();
        }
    }
    
    @Override
    public Long getTotalContributors(Long challengeId, int generation) {
        if (challengeId == null || !isAvailable()) {
            return 0L;
        }
        
        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.zcard(leaderboardKey(challengeId, generation));
        } catch (Exception e) {
            logger.warn("Failed to get contributor count from Redis for challenge {}: {}", challengeId, e.getMessage());
            return 0L;
        }
    }
    
    @Override
    public long getMirroredTotal(Long challengeId, int generation) {
        if (challengeId == null || !isAvailable()) {
            throw new IllegalStateException("Redis is not available");
        }
        
        try (Jedis jedis = jedisPool.getResource()) {
            String total = jedis.get(totalKey(challengeId, generation));
            return total != null ? Long.parseLong(total) : 0L;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to read mirrored total from Redis", e);
        }
    }
    
    @Override
    public void deleteLeaderboard(Long challengeId, int generation) {
        if (challengeId == null || !isAvailable()) {
            return;
        }
        
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.del(leaderboardKey(challengeId, generation), firstContributionKey(challengeId, generation),
                totalKey(challengeId, generation));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to delete leaderboard from Redis", e);
        }
    }
    
    static String leaderboardKey(Long challengeId, int generation) {
        return KEY_PREFIX + challengeId + ":" + generation + ":leaderboard";
    }
    
    static String firstContributionKey(Long challengeId, int generation) {
        return KEY_PREFIX + challengeId + ":" + generation + ":first-contributions";
    }
    
    static String totalKey(Long challengeId, int generation) {
        return KEY_PREFIX + challengeId + ":" + generation + ":total";
    }
}
