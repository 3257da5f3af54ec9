package com.pubsync.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * United 论文库中已有的记录,仅用于查重
 *
 * @author 席崇援
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReferenceRecordDTO {

    private String title;

    private Integer year;
}
