package com.agrilink.community.api.dto;

import com.agrilink.community.domain.model.User;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Public view of a user embedded in other resources (seller, author, expert).
 *
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class UserSummary {

    private Long id;
    private String name;
    private String imageUrl;
    private String role;

    public static UserSummary fromEntity(User user) {
        if (user == null) {
            return null;
        }
        UserSummary summary = new UserSummary();
        summary.setId(user.getId());
        summary.setName(user.getName());
        summary.setImageUrl(user.getImageUrl());
        summary.setRole(user.getRole().name().toLowerCase(Locale.ROOT));
        return summary;
    }
}
