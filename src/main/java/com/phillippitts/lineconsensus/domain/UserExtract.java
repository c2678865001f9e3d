package com.phillippitts.lineconsensus.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One contributor's extraction of a subject.
 *
 * @param userId contributor identity (any stable string, e.g. a user id or a session hash)
 * @param frames frame key to the lines this contributor drew there
 */
public record UserExtract(String userId, Map<String, FrameExtract> frames) {

    public UserExtract {
        Objects.requireNonNull(userId, "userId must not be null");
        frames = frames == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(frames));
    }

    public static UserExtract of(String userId, ClassificationExtract extract) {
        return new UserExtract(userId, extract.frames());
    }
}
