package com.supportdesk.infrastructure.dao;

import com.supportdesk.infrastructure.dao.po.SupportAgentPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 坐席 DAO
 */
@Mapper
public interface SupportAgentDao {

    SupportAgentPO selectById(@Param("id") Long id);

    /**
     * 查询活跃坐席，departmentId 为空时不过滤部门
     */
    List<SupportAgentPO> selectActive(@Param("departmentId") Long departmentId);
}
