package com.flowgraph.engine.sync;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.model.PluginEntry;
import com.flowgraph.document.model.Role;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps entry identity across a wholesale document replacement (e.g. a text edit): entries of the
 * new document take the key of the first unclaimed previous entry of the same role with the same
 * name, else of the unclaimed previous entry at the same index; anything left gets a fresh key.
 */
public final class EntryKeys {

    private EntryKeys() {
    }

    public static ConfigDocument carryOver(ConfigDocument previous, ConfigDocument next) {
        if (previous == null) return next.withEntryKeys();
        ConfigDocument result = next;
        for (Role role : Role.values()) {
            List<PluginEntry> before = previous.entries(role);
            List<PluginEntry> after = next.entries(role);
            if (after.isEmpty()) continue;
            boolean[] claimed = new boolean[before.size()];
            String[] keys = new String[after.size()];
            for (int i = 0; i < after.size(); i++) {
                String name = after.get(i).getName();
                if (name == null) continue;
                for (int j = 0; j < before.size(); j++) {
                    if (!claimed[j] && name.equals(before.get(j).getName()) && before.get(j).getKey() != null) {
                        claimed[j] = true;
                        keys[i] = before.get(j).getKey();
                        break;
                    }
                }
            }
            for (int i = 0; i < after.size(); i++) {
                if (keys[i] == null && i < before.size() && !claimed[i] && before.get(i).getKey() != null) {
                    claimed[i] = true;
                    keys[i] = before.get(i).getKey();
                }
            }
            List<PluginEntry> keyed = new ArrayList<>(after.size());
            for (int i = 0; i < after.size(); i++) {
                PluginEntry entry = after.get(i);
                keyed.add(keys[i] != null ? entry.withKey(keys[i]) : entry.withEnsuredKey());
            }
            result = result.withEntries(role, keyed);
        }
        return result.withEntryKeys();
    }
}
