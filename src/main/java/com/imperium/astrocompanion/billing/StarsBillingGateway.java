package com.imperium.astrocompanion.billing;

import com.imperium.astrocompanion.mapper.UserProfileMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 以 user_profiles.stars_balance 为账户的扣款实现。扣款为条件更新，余额不足时拒绝。
 */
@Service
public class StarsBillingGateway implements BillingGateway {

    private static final Logger log = LoggerFactory.getLogger(StarsBillingGateway.class);

    private final UserProfileMapper userProfileMapper;

    public StarsBillingGateway(UserProfileMapper userProfileMapper) {
        this.userProfileMapper = userProfileMapper;
    }

    @Override
    public ChargeResult charge(String userId, int amount) {
        if (amount <= 0) {
            return ChargeResult.APPROVED;
        }
        int updated = userProfileMapper.deductStars(userId, amount);
        if (updated == 0) {
            log.info("Charge of {} stars denied for user {}", amount, userId);
            return ChargeResult.DENIED;
        }
        log.info("Charged {} stars from user {}", amount, userId);
        return ChargeResult.APPROVED;
    }

    @Override
    public void refund(String userId, int amount) {
        if (amount <= 0) {
            return;
        }
        userProfileMapper.addStars(userId, amount);
        log.info("Refunded {} stars to user {}", amount, userId);
    }
}
