package com.imperium.mindjournal.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveResponse {

    /** conversation archived | conversation unarchived */
    private String status;
    private boolean archived;
}
