package com.supportdesk.infrastructure.dao;

import com.supportdesk.infrastructure.dao.po.SlaPolicyPO;
import com.supportdesk.types.enums.TicketPriorityEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * SLA 策略 DAO
 */
@Mapper
public interface SlaPolicyDao {

    SlaPolicyPO selectByDepartmentAndPriority(@Param("departmentId") Long departmentId,
                                              @Param("priority") TicketPriorityEnum priority);
}
