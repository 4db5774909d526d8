package com.imperium.astrocompanion.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.astrocompanion.model.entity.UserProfile;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

public interface UserProfileMapper extends BaseMapper<UserProfile> {

    /**
     * 余额充足时扣减星星。
     *
     * @return 受影响行数，0 表示余额不足或用户不存在
     */
    @Update("UPDATE user_profiles SET stars_balance = stars_balance - #{amount} "
            + "WHERE id = #{userId} AND stars_balance >= #{amount}")
    int deductStars(@Param("userId") String userId, @Param("amount") int amount);

    @Update("UPDATE user_profiles SET stars_balance = COALESCE(stars_balance, 0) + #{amount} WHERE id = #{userId}")
    int addStars(@Param("userId") String userId, @Param("amount") int amount);
}
