package com.disasteralert.service.store;

import com.disasteralert.core.model.Subscription;
import com.disasteralert.core.util.JsonUtils;
import com.disasteralert.engine.api.SubscriberDirectory;
import com.disasteralert.engine.grouping.LocationNormalizer;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Subscriptions persisted as a JSON array. Serves both the read-only directory used during
 * dispatch and the add/remove/list registry.
 */
public final class JsonFileSubscriptionStore implements SubscriberDirectory, SubscriptionRegistry {
    private final Path file;
    private final LocationNormalizer normalizer;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Subscription> subscriptions = new ArrayList<>();

    public JsonFileSubscriptionStore(Path file, LocationNormalizer normalizer) {
        this.file = file;
        this.normalizer = normalizer;
        load();
    }

    @Override
    public Map<String, List<String>> lookup(Set<String> locations) {
        lock.lock();
        try {
            Map<String, List<String>> byLocation = new LinkedHashMap<>();
            for (String location : locations) {
                byLocation.put(location, new ArrayList<>());
            }
            for (Subscription subscription : subscriptions) {
                List<String> recipients = byLocation.get(subscription.location());
                if (recipients != null) {
                    recipients.add(subscription.email());
                }
            }
            return byLocation;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public AddResult add(String location, String email) {
        Subscription subscription = canonical(location, email);
        lock.lock();
        try {
            if (subscriptions.contains(subscription)) {
                return AddResult.ALREADY_EXISTS;
            }
            subscriptions.add(subscription);
            try {
                persist();
            } catch (IllegalStateException e) {
                subscriptions.remove(subscriptions.size() - 1);
                throw e;
            }
            return AddResult.ADDED;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(String location, String email) {
        Subscription subscription = canonical(location, email);
        lock.lock();
        try {
            int index = subscriptions.indexOf(subscription);
            if (index < 0) {
                return false;
            }
            subscriptions.remove(index);
            try {
                persist();
            } catch (IllegalStateException e) {
                subscriptions.add(index, subscription);
                throw e;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Subscription> list() {
        lock.lock();
        try {
            return subscriptions.stream()
                    .sorted(Comparator.comparing(Subscription::location).thenComparing(Subscription::email))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    private Subscription canonical(String location, String email) {
        String canonicalLocation = normalizer.normalize(location);
        String trimmedEmail = email == null ? "" : email.trim();
        if (canonicalLocation.isEmpty()) {
            throw new IllegalArgumentException("location is required");
        }
        if (trimmedEmail.isEmpty()) {
            throw new IllegalArgumentException("email is required");
        }
        return new Subscription(canonicalLocation, trimmedEmail);
    }

    /**
     * Rows written by hand or by older versions are canonicalized like new ones, so a stored
     * "Bangalore" matches a "bengaluru" event. Rows missing a location or email are rejected.
     */
    private void load() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            List<Subscription> stored = JsonUtils.readFile(file, new TypeReference<List<Subscription>>() {
            });
            int position = 0;
            for (Subscription row : stored == null ? List.<Subscription>of() : stored) {
                position++;
                Subscription subscription;
                try {
                    subscription = canonical(row == null ? null : row.location(), row == null ? null : row.email());
                } catch (IllegalArgumentException invalid) {
                    throw new IllegalStateException("Invalid subscription at position " + position + " in " + file
                            + ": " + invalid.getMessage(), invalid);
                }
                if (!subscriptions.contains(subscription)) {
                    subscriptions.add(subscription);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read subscriptions from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            JsonUtils.writeFileAtomically(file, subscriptions);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to write subscriptions to " + file, e);
        }
    }
}
