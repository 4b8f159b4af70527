package com.advertis.infrastructure.dao;

import com.advertis.infrastructure.dao.po.SlotVersionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 槽位历史版本 DAO
 */
@Mapper
public interface SlotVersionDao {

    int insert(SlotVersionPO po);

    SlotVersionPO selectById(@Param("id") Long id);

    /**
     * 根据槽位 ID 查询，按创建时间降序
     */
    List<SlotVersionPO> selectBySlotId(@Param("slotId") Long slotId);
}
