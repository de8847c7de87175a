package com.partner.match.models;

import com.partner.match.dto.Participant;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Undirected partnership graph of participants, keyed by participant id.
 * Built per call; not safe for concurrent mutation.
 */
public class ParticipantGraph {
    private final Map<String, Set<String>> adjacency = new LinkedHashMap<>();

    /**
     * Builds the partnership graph of a pool: one edge per existing partnership, whichever
     * side recorded it.
     */
    public static ParticipantGraph fromPartnerships(Collection<Participant> participants) {
        ParticipantGraph graph = new ParticipantGraph();
        for (Participant participant : participants) {
            graph.addPartnerships(participant);
        }
        return graph;
    }

    public void addPartnerships(Participant participant) {
        addNode(participant.getId());
        for (String partnerId : participant.getPartnerIds()) {
            addEdge(participant.getId(), partnerId);
        }
    }

    public void addNode(String id) {
        adjacency.computeIfAbsent(id, k -> new LinkedHashSet<>());
    }

    public void addEdge(String left, String right) {
        if (left.equals(right)) {
            return;
        }
        addNode(left);
        addNode(right);
        adjacency.get(left).add(right);
        adjacency.get(right).add(left);
    }

    public List<String> getNeighbors(String id) {
        return new ArrayList<>(adjacency.getOrDefault(id, Set.of()));
    }

    public boolean hasEdge(String left, String right) {
        return adjacency.getOrDefault(left, Set.of()).contains(right);
    }
}
