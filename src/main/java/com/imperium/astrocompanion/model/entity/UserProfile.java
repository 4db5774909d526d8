package com.imperium.astrocompanion.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 用户档案表实体，对应 user_profiles 表。星盘、内容包与两本账以 JSON 列整体存储。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("user_profiles")
public class UserProfile {

    /** 用户ID（如 Telegram ID） */
    @TableId
    private String id;

    private String name;

    @TableField("birth_date")
    private LocalDate birthDate;

    /** HH:mm */
    @TableField("birth_time")
    private String birthTime;

    @TableField("birth_place")
    private String birthPlace;

    /** ru | en */
    private String language;

    @TableField("is_premium")
    private Boolean premium;

    /** 太阳星座，共享每日运势缓存的分组键 */
    @TableField("sun_sign")
    private String sunSign;

    @TableField("stars_balance")
    private Integer starsBalance;

    /** 星盘（JSON） */
    @TableField("chart_json")
    private String chartJson;

    /** 内容包（JSON），为空表示尚未首次生成 */
    @TableField("content_json")
    private String contentJson;

    /** 生成时间账（JSON） */
    @TableField("timestamps_json")
    private String timestampsJson;

    /** 重新生成用量账（JSON） */
    @TableField("regenerations_json")
    private String regenerationsJson;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
