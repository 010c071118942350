package com.phillippitts.talkbox.presentation.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/events}.
 *
 * @param content message text
 * @param source {@code text} or {@code live-chat}
 * @param userId originator id; admin ids get priority
 * @param userName display name, optional
 */
record EventRequest(
        @NotBlank @Size(max = 2000) String content,
        @NotBlank String source,
        @NotBlank String userId,
        String userName
) {}
