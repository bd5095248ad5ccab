package com.goormthonuniv.stagescore.store;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryReviewStore implements ReviewStore {

    private final ConcurrentMap<String, ShowSnapshot> shows = new ConcurrentHashMap<>();

    @Override
    public Optional<ShowSnapshot> load(String showId) {
        return Optional.ofNullable(shows.get(showId));
    }

    @Override
    public void replace(ShowSnapshot snapshot) {
        shows.put(snapshot.showId(), snapshot);
    }

    @Override
    public Set<String> showIds() {
        return new TreeSet<>(shows.keySet());
    }
}
