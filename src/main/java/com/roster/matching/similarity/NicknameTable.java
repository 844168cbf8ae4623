package com.roster.matching.similarity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable table of curated first-name groups, e.g. {@code robert: [rob, bob, bobby]}.
 *
 * <p>Two names are equivalent only when they share a group. A name may appear in
 * several groups ("chris" in both "christopher" and "christine") without making
 * those groups equivalent to each other.</p>
 */
public final class NicknameTable {

    /** Classpath location of the bundled table. */
    public static final String DEFAULT_RESOURCE = "/nicknames.json";

    private static final NicknameTable EMPTY = new NicknameTable(Map.of());

    private final Map<String, Set<String>> groups;
    private final Map<String, Set<String>> groupsByName;

    private NicknameTable(Map<String, ? extends Collection<String>> rawGroups) {
        Map<String, Set<String>> normalizedGroups = new LinkedHashMap<>();
        Map<String, Set<String>> index = new HashMap<>();

        for (Map.Entry<String, ? extends Collection<String>> entry : rawGroups.entrySet()) {
            String groupName = NameNormalizer.normalize(entry.getKey());
            if (groupName.isEmpty()) {
                throw new IllegalArgumentException("Nickname group name must not be blank");
            }
            Set<String> members = new HashSet<>();
            members.add(groupName);
            for (String member : entry.getValue()) {
                String normalized = NameNormalizer.normalize(member);
                if (!normalized.isEmpty()) {
                    members.add(normalized);
                }
            }
            normalizedGroups.merge(groupName, members, (a, b) -> {
                Set<String> merged = new HashSet<>(a);
                merged.addAll(b);
                return merged;
            });
        }

        normalizedGroups.forEach((groupName, members) -> {
            for (String member : members) {
                index.computeIfAbsent(member, k -> new HashSet<>()).add(groupName);
            }
        });

        Map<String, Set<String>> frozenGroups = new LinkedHashMap<>();
        normalizedGroups.forEach((k, v) -> frozenGroups.put(k, Set.copyOf(v)));
        Map<String, Set<String>> frozenIndex = new HashMap<>();
        index.forEach((k, v) -> frozenIndex.put(k, Set.copyOf(v)));

        this.groups = Map.copyOf(frozenGroups);
        this.groupsByName = Map.copyOf(frozenIndex);
    }

    /**
     * Builds a table from group name to members. The group name is itself a member.
     */
    public static NicknameTable of(Map<String, ? extends Collection<String>> groups) {
        Objects.requireNonNull(groups, "groups is required");
        return new NicknameTable(groups);
    }

    public static NicknameTable empty() {
        return EMPTY;
    }

    /**
     * Loads the bundled table from {@value #DEFAULT_RESOURCE}.
     *
     * @throws IllegalStateException if the resource is missing
     */
    public static NicknameTable defaults() {
        try (InputStream in = NicknameTable.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Nickname resource not found: " + DEFAULT_RESOURCE);
            }
            return fromJson(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read nickname resource " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Reads a JSON object of the form {@code {"group": ["name", ...], ...}}.
     */
    public static NicknameTable fromJson(InputStream in) throws IOException {
        Map<String, List<String>> raw = new ObjectMapper()
                .readValue(in, new TypeReference<Map<String, List<String>>>() {});
        return new NicknameTable(raw);
    }

    /**
     * Returns true when both names belong to at least one common group.
     * Inputs are compared in {@link NameNormalizer} form.
     */
    public boolean sameGroup(String name1, String name2) {
        Set<String> groups1 = groupsByName.get(NameNormalizer.normalize(name1));
        if (groups1 == null) {
            return false;
        }
        Set<String> groups2 = groupsByName.get(NameNormalizer.normalize(name2));
        if (groups2 == null) {
            return false;
        }
        for (String group : groups1) {
            if (groups2.contains(group)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns every name sharing a group with the given one, including itself.
     */
    public Set<String> variationsOf(String name) {
        String normalized = NameNormalizer.normalize(name);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        Set<String> result = new HashSet<>();
        result.add(normalized);
        for (String group : groupsByName.getOrDefault(normalized, Set.of())) {
            result.addAll(groups.get(group));
        }
        return Set.copyOf(result);
    }

    public int groupCount() {
        return groups.size();
    }
}
