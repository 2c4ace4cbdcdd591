package com.supportdesk.infrastructure.dao;

import com.supportdesk.infrastructure.dao.po.DepartmentPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 部门 DAO
 */
@Mapper
public interface DepartmentDao {

    DepartmentPO selectById(@Param("id") Long id);

    List<DepartmentPO> selectAll();
}
