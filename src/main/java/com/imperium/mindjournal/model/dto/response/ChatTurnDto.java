package com.imperium.mindjournal.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 内存对话历史中的一条记录。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatTurnDto {

    /** system | user | assistant */
    private String role;
    private String content;
}
