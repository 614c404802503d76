package com.id.pibridge.modules.stream.service;

import com.id.pibridge.modules.stream.model.StreamChannelConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Channels minted for streamable results. A new channel is created on every call, entries are only dropped
 * when the application shuts down.
 */
@Service
@Slf4j
public class StreamChannelRegistry {

    public static final String CHANNEL_PREFIX = "ds/";

    private final Map<String, StreamChannelConstruct> channels = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Registers a new channel.
     *
     * @return the channel address, {@code ds/<datasourceUid>/<channelId>}
     */
    public String register(String datasourceUid, String webId, long intervalNanoSeconds) {
        var channelId = UUID.randomUUID().toString();
        lock.lock();
        try {
            channels.put(channelId, new StreamChannelConstruct(webId, intervalNanoSeconds));
        } finally {
            lock.unlock();
        }
        return address(datasourceUid, channelId);
    }

    public Optional<StreamChannelConstruct> find(String channelId) {
        lock.lock();
        try {
            return Optional.ofNullable(channels.get(channelId));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return channels.size();
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void clear() {
        lock.lock();
        try {
            log.debug("Dropping {} stream channels", channels.size());
            channels.clear();
        } finally {
            lock.unlock();
        }
    }

    public static String address(String datasourceUid, String channelId) {
        return CHANNEL_PREFIX + datasourceUid + "/" + channelId;
    }

    /**
     * Channel id part of an address, or the input itself when it is not an address.
     */
    public static String channelIdOf(String address) {
        int slash = address.lastIndexOf('/');
        return slash < 0 ? address : address.substring(slash + 1);
    }
}
