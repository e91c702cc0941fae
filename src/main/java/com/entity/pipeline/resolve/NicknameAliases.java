package com.entity.pipeline.resolve;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Bidirectional nickname groups. A formal name and its nicknames form one group;
 * a token may belong to several groups ("kathy" for both katherine and kathryn).
 * Two tokens are equivalent when they are equal or share a group.
 */
public class NicknameAliases {

    private final Map<String, Set<String>> groupsByToken = new HashMap<>();

    public NicknameAliases(Map<String, List<String>> nicknames) {
        for (Map.Entry<String, List<String>> entry : nicknames.entrySet()) {
            String formal = entry.getKey().toLowerCase(Locale.ROOT);
            register(formal, formal);
            for (String nickname : entry.getValue()) {
                register(nickname.toLowerCase(Locale.ROOT), formal);
            }
        }
    }

    private void register(String token, String group) {
        groupsByToken.computeIfAbsent(token, k -> new TreeSet<>()).add(group);
    }

    public boolean tokensEquivalent(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        Set<String> groupsA = groupsByToken.get(a);
        Set<String> groupsB = groupsByToken.get(b);
        if (groupsA == null || groupsB == null) {
            return false;
        }
        for (String group : groupsA) {
            if (groupsB.contains(group)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether two normalized names differ only by nickname substitutions, token by token.
     */
    public boolean namesEquivalent(String normalizedA, String normalizedB) {
        String[] tokensA = normalizedA.split(" ");
        String[] tokensB = normalizedB.split(" ");
        if (tokensA.length != tokensB.length) {
            return false;
        }
        for (int i = 0; i < tokensA.length; i++) {
            if (!tokensEquivalent(tokensA[i], tokensB[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Replaces each token by the first formal name of its group, so that nickname variants
     * of a name share one blocking key.
     */
    public String canonicalForm(String normalizedName) {
        if (normalizedName.isEmpty()) {
            return normalizedName;
        }
        List<String> tokens = new ArrayList<>();
        for (String token : normalizedName.split(" ")) {
            Set<String> groups = groupsByToken.get(token);
            tokens.add(groups != null ? groups.iterator().next() : token);
        }
        return String.join(" ", tokens);
    }

    public boolean isKnown(String token) {
        return groupsByToken.containsKey(token);
    }
}
