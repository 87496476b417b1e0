package com.imperium.mindjournal.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatReplyResponse {

    /** assistant 回复全文 */
    private String response;
}
