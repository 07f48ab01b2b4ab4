package com.disasteralert.service.store;

import com.disasteralert.core.model.Subscription;

import java.util.List;

public interface SubscriptionRegistry {
    AddResult add(String location, String email);

    /**
     * @return true when a subscription was removed
     */
    boolean remove(String location, String email);

    /**
     * All subscriptions ordered by location, then email.
     */
    List<Subscription> list();

    enum AddResult {
        ADDED,
        ALREADY_EXISTS
    }
}
