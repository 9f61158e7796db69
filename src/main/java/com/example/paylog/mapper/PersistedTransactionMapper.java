package com.example.paylog.mapper;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.paylog.model.PersistedTransaction;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

/**
 * Finders go through wrappers rather than {@code @Select} so the entity's auto result map
 * (and with it the txn_type type handler) applies.
 */
@Mapper
public interface PersistedTransactionMapper extends BaseMapper<PersistedTransaction> {

    /**
     * Records of one owner, newest first.
     */
    default List<PersistedTransaction> findByOwnerId(String ownerId) {
        return selectList(new LambdaQueryWrapper<PersistedTransaction>()
                .eq(PersistedTransaction::getOwnerId, ownerId)
                .orderByDesc(PersistedTransaction::getCreatedAt));
    }
}
