package com.imperium.astrocompanion.support;

import com.imperium.astrocompanion.billing.BillingGateway;
import com.imperium.astrocompanion.billing.ChargeResult;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class FakeBillingGateway implements BillingGateway {

    private final Map<String, Integer> balances = new ConcurrentHashMap<>();
    private final AtomicInteger charges = new AtomicInteger();
    private final AtomicInteger refunded = new AtomicInteger();

    public FakeBillingGateway balance(String userId, int stars) {
        balances.put(userId, stars);
        return this;
    }

    @Override
    public ChargeResult charge(String userId, int amount) {
        int balance = balances.getOrDefault(userId, 0);
        if (balance < amount) {
            return ChargeResult.DENIED;
        }
        balances.put(userId, balance - amount);
        charges.incrementAndGet();
        return ChargeResult.APPROVED;
    }

    @Override
    public void refund(String userId, int amount) {
        balances.merge(userId, amount, Integer::sum);
        refunded.addAndGet(amount);
    }

    public int balanceOf(String userId) {
        return balances.getOrDefault(userId, 0);
    }

    public int chargeCount() {
        return charges.get();
    }

    public int refundedTotal() {
        return refunded.get();
    }
}
