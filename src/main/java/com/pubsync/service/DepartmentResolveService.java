package com.pubsync.service;

import com.pubsync.model.dto.DepartmentMappingDTO;
import com.pubsync.model.vo.DepartmentResolutionVO;

import java.util.List;

/**
 * 作者院系匹配服务
 *
 * @author 席崇援
 */
public interface DepartmentResolveService {

    /**
     * 根据对照表确定作者所属院系
     *
     * @param authorsShort      作者短名,"; " 分隔,如 "Smith, J.; Doe, A."
     * @param departmentMapping 作者-院系对照表
     * @return 去重后的院系及是否需要人工复核
     */
    DepartmentResolutionVO resolve(String authorsShort, List<DepartmentMappingDTO> departmentMapping);
}
