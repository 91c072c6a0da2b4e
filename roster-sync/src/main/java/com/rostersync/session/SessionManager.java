package com.rostersync.session;

import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Tracks the observers connected to the feed server.
 *
 * Thread Safety:
 * - Backed by a ConcurrentHashMap keyed by channel id
 * - All methods can be called from any thread
 */
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, ObserverSession> sessionsByChannelId = new ConcurrentHashMap<>();

    public ObserverSession createSession(Channel channel) {
        ObserverSession session = new ObserverSession(channel);
        String channelId = channel.id().asLongText();
        sessionsByChannelId.put(channelId, session);

        logger.info("Session created: {} (channel: {})", session.getSessionId(), channelId);
        logger.debug("Total observer sessions: {}", sessionsByChannelId.size());
        return session;
    }

    /**
     * @return the removed session, or null if the channel had none
     */
    public ObserverSession removeSession(Channel channel) {
        String channelId = channel.id().asLongText();
        ObserverSession session = sessionsByChannelId.remove(channelId);

        if (session != null) {
            logger.info("Session removed: {} (channel: {})", session.getSessionId(), channelId);
            logger.debug("Total observer sessions: {}", sessionsByChannelId.size());
        }
        return session;
    }

    public ObserverSession getSessionByChannel(Channel channel) {
        return sessionsByChannelId.get(channel.id().asLongText());
    }

    /**
     * Active sessions that have asked for the roster stream.
     * Note: a point-in-time copy.
     */
    public List<ObserverSession> getSubscribedSessions() {
        return sessionsByChannelId.values().stream()
                .filter(s -> s.isSubscribed() && s.isActive())
                .collect(Collectors.toList());
    }

    public int getSessionCount() {
        return sessionsByChannelId.size();
    }
}
