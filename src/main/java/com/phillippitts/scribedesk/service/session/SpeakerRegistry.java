package com.phillippitts.scribedesk.service.session;

import com.phillippitts.scribedesk.domain.Speaker;
import com.phillippitts.scribedesk.exception.InvalidOperationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Speaker definitions and the single active speaker.
 *
 * <p>Speakers are kept in creation order. Ids ({@code spk-1}, {@code spk-2}, ...) are never
 * reused. New speakers take the next colour of a fixed palette unless one is given. Rename and
 * recolour listeners receive the updated speaker.
 *
 * <p>Not thread-safe: callers serialize access through the session lock.
 */
@Component
public class SpeakerRegistry {

    private static final Logger LOG = LogManager.getLogger(SpeakerRegistry.class);

    static final List<String> PALETTE = List.of(
            "#1f77b4", "#ff7f0e", "#2ca02c", "#d62728",
            "#9467bd", "#8c564b", "#e377c2", "#7f7f7f");

    private final Map<String, Speaker> speakers = new LinkedHashMap<>();
    private final List<Consumer<Speaker>> changeListeners = new CopyOnWriteArrayList<>();
    private long nextId = 1;
    private String activeSpeakerId;

    /**
     * Adds a speaker with the next palette colour.
     *
     * @see #addSpeaker(String, String)
     */
    public Speaker addSpeaker(String name) {
        return addSpeaker(name, PALETTE.get(speakers.size() % PALETTE.size()));
    }

    /**
     * Adds a speaker. If no speaker is active, the new one becomes active.
     *
     * @throws InvalidOperationException if the name is blank or already used, or the colour is not {@code #rrggbb}
     */
    public Speaker addSpeaker(String name, String color) {
        String normalized = requireUsableName(name, null);
        if (!Speaker.isValidColor(color)) {
            throw new InvalidOperationException("Speaker color must be #rrggbb, got: " + color);
        }
        Speaker speaker = new Speaker("spk-" + nextId++, normalized, color);
        speakers.put(speaker.id(), speaker);
        LOG.info("Speaker added: id={}, color={}", speaker.id(), speaker.color());
        if (activeSpeakerId == null) {
            activeSpeakerId = speaker.id();
        }
        return speaker;
    }

    /**
     * @throws InvalidOperationException if the speaker is unknown or the name is blank or taken
     */
    public Speaker rename(String speakerId, String newName) {
        Speaker current = require(speakerId);
        String normalized = requireUsableName(newName, speakerId);
        Speaker updated = current.withName(normalized);
        replace(updated);
        return updated;
    }

    /**
     * @throws InvalidOperationException if the speaker is unknown or the colour is not {@code #rrggbb}
     */
    public Speaker recolor(String speakerId, String color) {
        Speaker current = require(speakerId);
        if (!Speaker.isValidColor(color)) {
            throw new InvalidOperationException("Speaker color must be #rrggbb, got: " + color);
        }
        Speaker updated = current.withColor(color);
        replace(updated);
        return updated;
    }

    /**
     * Makes {@code speakerId} the active speaker.
     *
     * @return the previously active speaker id, if any
     * @throws InvalidOperationException if no speakers exist or the id is unknown
     */
    public Optional<String> activate(String speakerId) {
        if (speakers.isEmpty()) {
            throw new InvalidOperationException("No speakers defined");
        }
        require(speakerId);
        String previous = activeSpeakerId;
        activeSpeakerId = speakerId;
        return Optional.ofNullable(previous);
    }

    public Optional<String> activeSpeakerId() {
        return Optional.ofNullable(activeSpeakerId);
    }

    public Optional<Speaker> find(String speakerId) {
        return Optional.ofNullable(speakers.get(speakerId));
    }

    /**
     * @throws InvalidOperationException if the id is unknown
     */
    public Speaker require(String speakerId) {
        Speaker s = speakers.get(speakerId);
        if (s == null) {
            throw new InvalidOperationException("Unknown speaker: " + speakerId);
        }
        return s;
    }

    /** Speakers in creation order. */
    public List<Speaker> speakers() {
        return List.copyOf(speakers.values());
    }

    public boolean isEmpty() {
        return speakers.isEmpty();
    }

    /**
     * Registers a listener notified after a speaker's name or colour changed.
     */
    public void addChangeListener(Consumer<Speaker> listener) {
        changeListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private void replace(Speaker updated) {
        speakers.put(updated.id(), updated);
        for (Consumer<Speaker> l : changeListeners) {
            l.accept(updated);
        }
    }

    private String requireUsableName(String name, String exceptId) {
        if (name == null || name.isBlank()) {
            throw new InvalidOperationException("Speaker name must not be blank");
        }
        String normalized = name.strip();
        for (Speaker s : speakers.values()) {
            if (s.name().equals(normalized) && !s.id().equals(exceptId)) {
                throw new InvalidOperationException("Speaker name already exists: " + normalized);
            }
        }
        return normalized;
    }
}
