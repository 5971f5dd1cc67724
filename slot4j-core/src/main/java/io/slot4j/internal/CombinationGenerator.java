package io.slot4j.internal;

import io.slot4j.core.Participant;
import io.slot4j.core.SearchOptions;
import io.slot4j.core.Session;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Enumerates participant subsets per session.
 *
 * <p>Order is lexicographic by pool order; the single-day search explores subsets in this order,
 * so it also decides which of two equally ranked results comes first.
 */
public final class CombinationGenerator {
    private CombinationGenerator() {
    }

    /**
     * All {@code C(n, k)} subsets of {@code pool}, each in pool order.
     */
    public static <T> List<List<T>> choose(List<T> pool, int k) {
        List<List<T>> out = new ArrayList<>();
        if (k < 0) {
            return out;
        }
        choose(pool, 0, k, new ArrayList<>(k), out);
        return out;
    }

    private static <T> void choose(List<T> pool, int from, int k, List<T> picked, List<List<T>> out) {
        if (k == 0) {
            out.add(List.copyOf(picked));
            return;
        }
        int remaining = pool.size() - from;
        if (remaining <= 0 || k > remaining) {
            return;
        }

        // with pool[from]
        picked.add(pool.get(from));
        choose(pool, from + 1, k - 1, picked, out);
        picked.remove(picked.size() - 1);

        // without pool[from]
        choose(pool, from + 1, k, picked, out);
    }

    /**
     * Subsets mixing 1..min(k, trainees) trainees with the remaining regular participants.
     * Regular members come first in each subset.
     */
    public static List<List<Participant>> chooseWithTrainees(List<Participant> regular, List<Participant> trainees, int k) {
        List<List<Participant>> out = new ArrayList<>();
        int maxTrainees = Math.min(k, trainees.size());
        for (int t = 1; t <= maxTrainees; t++) {
            int needRegular = k - t;
            if (needRegular > regular.size()) {
                continue;
            }
            List<List<Participant>> regularSubsets = choose(regular, needRegular);
            List<List<Participant>> traineeSubsets = choose(trainees, t);
            for (List<Participant> r : regularSubsets) {
                for (List<Participant> tr : traineeSubsets) {
                    List<Participant> subset = new ArrayList<>(r.size() + tr.size());
                    subset.addAll(r);
                    subset.addAll(tr);
                    out.add(List.copyOf(subset));
                }
            }
        }
        return out;
    }

    /**
     * Candidate subsets for one session: the regular pass over non-trainees, then, when enabled for
     * both the search and the session, the trainee pass.
     */
    public static List<List<Participant>> forSession(Session session, List<Participant> participants, SearchOptions options) {
        List<Participant> pool = poolFor(session, participants);

        List<Participant> regular = new ArrayList<>();
        List<Participant> trainees = new ArrayList<>();
        for (Participant p : pool) {
            if (p.trainee()) {
                trainees.add(p);
            } else {
                regular.add(p);
            }
        }

        List<List<Participant>> subsets = choose(regular, session.requiredCount());
        if (options.includeTrainingParticipants() && session.acceptsTrainees() && !trainees.isEmpty()) {
            subsets.addAll(chooseWithTrainees(regular, trainees, session.requiredCount()));
        }
        return subsets;
    }

    private static List<Participant> poolFor(Session session, List<Participant> participants) {
        if (session.candidatePool() == null) {
            return participants;
        }
        Set<String> allowed = new HashSet<>(session.candidatePool());
        List<Participant> pool = new ArrayList<>();
        for (Participant p : participants) {
            if (allowed.contains(p.id())) {
                pool.add(p);
            }
        }
        return pool;
    }
}
