package com.partd.campusqa.service;

import com.partd.campusqa.model.AnswerResult;
import com.partd.campusqa.model.HallRecord;
import com.partd.campusqa.model.RoomPrice;
import com.partd.campusqa.model.RoomType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Renders hall records as answer text and source citations.
 * Missing fields are shown as {@link #PLACEHOLDER}; nothing here throws on incomplete records.
 */
@Component
public class HallAnswerFormatter {

    public static final String PLACEHOLDER = "—";

    static final int SNIPPET_LENGTH = 240;
    static final int SHORTLIST_DESCRIPTION_LENGTH = 140;

    public String formatDetail(HallRecord hall) {
        StringBuilder sb = new StringBuilder();
        sb.append("**").append(orPlaceholder(hall.getName())).append("**\n");
        sb.append(orPlaceholder(hall.getShortDescription())).append("\n\n");

        sb.append("Address: ").append(orPlaceholder(hall.getAddress())).append("\n");
        sb.append("Catering: ").append(orPlaceholder(hall.getCateringType())).append("\n");
        sb.append("Tags: ").append(join(hall.getTags())).append("\n");
        sb.append("Lifestyle: ").append(join(hall.getLifestyleTags())).append("\n");
        sb.append("Facilities: ").append(join(hall.getFacilities())).append("\n");
        sb.append("Room features: ").append(join(hall.getRoomFeaturesCommon())).append("\n");
        sb.append("Services: ").append(join(hall.getServices())).append("\n\n");

        if (hall.getRoomTypes().isEmpty()) {
            sb.append("Room types: ").append(PLACEHOLDER).append("\n\n");
        } else {
            sb.append("Room types (current prices):\n");
            for (RoomType room : hall.getRoomTypes()) {
                if (room != null) {
                    sb.append("- ").append(formatRoom(room)).append("\n");
                }
            }
            sb.append("\n");
        }

        sb.append("Contact: ").append(orPlaceholder(hall.getContactEmail()))
          .append(" | ").append(orPlaceholder(hall.getContactPhone())).append("\n");
        sb.append("Official page: ").append(orPlaceholder(hall.getOfficialUrl()));
        return sb.toString();
    }

    public String formatShortlist(List<HallMatcher.ScoredHall> shortlist, Set<String> wantedTags) {
        StringBuilder sb = new StringBuilder();
        if (wantedTags == null || wantedTags.isEmpty()) {
            sb.append("Here are some halls you could look at:\n");
        } else {
            sb.append("Halls that fit what you asked for (")
              .append(String.join(", ", wantedTags).replace('_', ' '))
              .append("):\n");
        }

        for (HallMatcher.ScoredHall entry : shortlist) {
            HallRecord hall = entry.getHall();
            sb.append("\n• **").append(orPlaceholder(hall.getName())).append("**: ")
              .append(orPlaceholder(truncate(hall.getShortDescription(), SHORTLIST_DESCRIPTION_LENGTH, true)))
              .append("\n");
            sb.append("  Tags: ").append(join(hall.getTags()))
              .append(" | Lifestyle: ").append(join(hall.getLifestyleTags())).append("\n");
            sb.append("  More info: ").append(orPlaceholder(hall.getOfficialUrl())).append("\n");
        }
        return sb.toString().stripTrailing();
    }

    public AnswerResult.SourceCitation toSource(HallRecord hall) {
        return AnswerResult.SourceCitation.builder()
                .title(hall.getName())
                .url(hall.getOfficialUrl())
                .snippet(truncate(hall.getShortDescription(), SNIPPET_LENGTH, false))
                .build();
    }

    /**
     * One room line with its current (last) price; only the year is printed when amounts are missing.
     */
    String formatRoom(RoomType room) {
        List<String> attributes = new ArrayList<>();
        if (room.getEnsuite() != null) {
            attributes.add(room.getEnsuite() ? "en-suite" : "shared bathroom");
        }
        if (room.getTenancyWeeks() != null) {
            attributes.add(room.getTenancyWeeks() + " weeks");
        }

        StringBuilder line = new StringBuilder(orPlaceholder(room.getName()));
        if (!attributes.isEmpty()) {
            line.append(" (").append(String.join(", ", attributes)).append(")");
        }
        line.append(": ").append(formatPrice(room.currentPrice()));
        return line.toString();
    }

    String formatPrice(RoomPrice price) {
        if (price == null) {
            return PLACEHOLDER;
        }
        List<String> amounts = new ArrayList<>();
        if (price.getPerWeekAmount() != null) {
            amounts.add(money(price.getPerWeekAmount()) + "/week");
        }
        if (price.getTotalAmount() != null) {
            amounts.add(money(price.getTotalAmount()) + " total");
        }

        String year = isBlank(price.getYear()) ? null : price.getYear().trim();
        if (amounts.isEmpty()) {
            return year != null ? year : PLACEHOLDER;
        }
        String joined = String.join(", ", amounts);
        return year != null ? year + " " + joined : joined;
    }

    static String truncate(String text, int maxLength, boolean ellipsis) {
        if (text == null) {
            return null;
        }
        String trimmed = text.strip();
        if (trimmed.length() <= maxLength) {
            return trimmed;
        }
        String cut = trimmed.substring(0, maxLength);
        return ellipsis ? cut.stripTrailing() + "…" : cut;
    }

    private static String money(BigDecimal amount) {
        return String.format(Locale.UK, "£%,.2f", amount);
    }

    private static String join(List<String> values) {
        List<String> present = new ArrayList<>();
        for (String value : values) {
            if (!isBlank(value)) {
                present.add(value.trim());
            }
        }
        return present.isEmpty() ? PLACEHOLDER : String.join(", ", present);
    }

    private static String orPlaceholder(String value) {
        return isBlank(value) ? PLACEHOLDER : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
