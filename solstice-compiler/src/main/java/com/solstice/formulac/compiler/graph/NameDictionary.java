package com.solstice.formulac.compiler.graph;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes variable names to dense integer ids in first-seen order.
 * Ids are therefore also discovery positions.
 */
public class NameDictionary {

    private final Object2IntMap<String> nameToId = new Object2IntOpenHashMap<>();
    private final List<String> idToName = new ArrayList<>();

    public NameDictionary() {
        nameToId.defaultReturnValue(-1);
    }

    /**
     * Id of {@code name}, assigning the next free id on first sight.
     */
    public int encode(String name) {
        return nameToId.computeIfAbsent(name, (String s) -> {
            int id = idToName.size();
            idToName.add(s);
            return id;
        });
    }

    public String decode(int id) {
        if (id >= 0 && id < idToName.size()) {
            return idToName.get(id);
        }
        return null;
    }

    /**
     * @return the id, or -1 when the name was never encoded
     */
    public int getId(String name) {
        return nameToId.getInt(name);
    }

    public int size() {
        return idToName.size();
    }
}
