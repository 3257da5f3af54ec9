package com.pubsync.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 作者-院系对照行
 * 同一作者可出现在多行(隶属多个院系),院系可能为空
 *
 * @author 席崇援
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartmentMappingDTO {

    /**
     * 作者短名,如 "Smith, J."
     */
    private String authorName;

    /**
     * 院系名称
     */
    private String department;
}
