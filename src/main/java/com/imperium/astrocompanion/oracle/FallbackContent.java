package com.imperium.astrocompanion.oracle;

import com.imperium.astrocompanion.model.domain.ContentCategory;
import com.imperium.astrocompanion.model.domain.DailyForecast;
import com.imperium.astrocompanion.model.domain.DeepDiveTopic;
import com.imperium.astrocompanion.model.domain.Language;

import java.time.LocalDate;

/**
 * Oracle 失败时使用的本地化兜底文本。
 */
public final class FallbackContent {

    private FallbackContent() {
    }

    public static String intro(String name, Language language) {
        if (language.isRussian()) {
            return name + ", ваша натальная карта раскрывает уникальное сочетание энергий. "
                    + "Подробная интерпретация скоро будет доступна.";
        }
        return name + ", your natal chart reveals a unique blend of energies. "
                + "A detailed interpretation will be available soon.";
    }

    public static String deepDive(DeepDiveTopic topic, Language language) {
        if (language.isRussian()) {
            return "Анализ раздела «" + topic.title(language) + "» временно недоступен. Попробуйте позже.";
        }
        return "The \"" + topic.title(language) + "\" analysis is temporarily unavailable. Please try again later.";
    }

    public static String threeKeys(Language language) {
        if (language.isRussian()) {
            return "Три ключа к вашей карте сейчас готовятся. Загляните чуть позже.";
        }
        return "Your three keys are being prepared. Please check back a little later.";
    }

    public static String weeklyHoroscope(Language language) {
        if (language.isRussian()) {
            return "На этой неделе сосредоточьтесь на главном и берегите свои силы.";
        }
        return "This week, focus on what matters most and pace your energy.";
    }

    public static String monthlyHoroscope(Language language) {
        if (language.isRussian()) {
            return "Этот месяц принесёт важные изменения в вашей жизни.";
        }
        return "This month will bring important changes to your life.";
    }

    /**
     * 文本类别的兜底内容。
     */
    public static String text(ContentCategory category, String name, Language language) {
        return switch (category) {
            case NATAL_INTRO -> intro(name, language);
            case THREE_KEYS -> threeKeys(language);
            case WEEKLY_HOROSCOPE -> weeklyHoroscope(language);
            case MONTHLY_HOROSCOPE -> monthlyHoroscope(language);
            case DAILY_HOROSCOPE, TRANSIT_FORECAST ->
                    throw new IllegalArgumentException("No text fallback for " + category.key());
            default -> deepDive(category.topic().orElseThrow(), language);
        };
    }

    public static DailyForecast dailyForecast(LocalDate date, Language language) {
        return DailyForecast.builder()
                .date(date)
                .mood(language.isRussian() ? "Спокойный" : "Calm")
                .content(language.isRussian()
                        ? "Сегодня звёзды советуют прислушаться к себе и не торопить события."
                        : "Today the stars suggest listening to yourself and not rushing things.")
                .build();
    }
}
