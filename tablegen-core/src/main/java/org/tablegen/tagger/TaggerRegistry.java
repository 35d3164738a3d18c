package org.tablegen.tagger;

import org.tablegen.exception.UnknownTagGeneratorException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Known tag generators by id. Resolution happens once, at configuration time, so an
 * unknown id fails before any database work starts.
 */
public final class TaggerRegistry {

    private static final Map<String, Tagger> TAGGERS;

    static {
        Map<String, Tagger> taggers = new LinkedHashMap<>();
        taggers.put(DbTagger.ID, new DbTagger());
        taggers.put(StructableTagger.ID, new StructableTagger());
        taggers.put(JsonTagger.ID, new JsonTagger());
        TAGGERS = Collections.unmodifiableMap(taggers);
    }

    private TaggerRegistry() {
    }

    public static Set<String> ids() {
        return TAGGERS.keySet();
    }

    /**
     * Resolves {@code ids} in the given order. Blank entries are skipped and duplicates
     * keep their first position.
     *
     * @throws UnknownTagGeneratorException for the first id that is not registered
     */
    public static List<Tagger> resolve(List<String> ids) {
        if (ids == null) {
            return List.of();
        }
        List<Tagger> resolved = new ArrayList<>();
        for (String raw : ids) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String id = raw.trim();
            Tagger tagger = TAGGERS.get(id);
            if (tagger == null) {
                throw new UnknownTagGeneratorException(id, new TreeSet<>(TAGGERS.keySet()));
            }
            if (!resolved.contains(tagger)) {
                resolved.add(tagger);
            }
        }
        return List.copyOf(resolved);
    }
}
