package io.github.manjago.talos.train;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fixed-size list of individuals of one generation.
 */
public final class Population {

    private final List<Individual> members;

    public Population(List<Individual> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Empty population");
        }
        this.members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }

    public Individual get(int index) {
        return members.get(index);
    }

    public List<Individual> members() {
        return members;
    }

    /**
     * Members by descending fitness; equal fitness keeps member order.
     */
    public List<Individual> ranked() {
        List<Individual> ranked = new ArrayList<>(members);
        ranked.sort(Comparator.comparingLong(Individual::fitness).reversed());
        return ranked;
    }

    public Individual best() {
        return ranked().get(0);
    }

    /**
     * The best quarter, at least one member.
     */
    public List<Individual> survivors() {
        return ranked().subList(0, Math.max(1, members.size() / 4));
    }
}
