package com.imperium.astrocompanion.model.dto.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.ContentBundle;
import com.imperium.astrocompanion.model.domain.Profile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProfileResponse {

    private String id;

    private String name;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate birthDate;

    private String birthTime;

    private String birthPlace;

    private String language;

    private boolean premium;

    /** 太阳星座分组，如 Pisces */
    private String sunSign;

    private ChartFacts chart;

    private ContentBundle content;

    /** 类别 key -> 最后生成时间（epoch 毫秒） */
    private Map<String, Long> generatedAt;

    public static ProfileResponse from(Profile profile) {
        return ProfileResponse.builder()
                .id(profile.getId())
                .name(profile.getName())
                .birthDate(profile.getBirthDate())
                .birthTime(profile.getBirthTime())
                .birthPlace(profile.getBirthPlace())
                .language(profile.getLanguage() != null ? profile.getLanguage().tag() : null)
                .premium(profile.isPremium())
                .sunSign(profile.getSunSign() != null ? profile.getSunSign().displayName() : null)
                .chart(profile.getChart())
                .content(profile.getBundle())
                .generatedAt(profile.getTimestamps() != null ? profile.getTimestamps().asMap() : null)
                .build();
    }
}
