package com.advertis.test;

import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.infrastructure.dao.SlotDao;
import com.advertis.infrastructure.dao.StrategyDao;
import com.advertis.infrastructure.dao.po.SlotPO;
import com.advertis.infrastructure.repository.strategy.SlotRepositoryImpl;
import com.advertis.infrastructure.repository.strategy.StrategyRepositoryImpl;
import com.advertis.infrastructure.util.JsonCodec;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.enums.SlotStatusEnum;
import com.advertis.types.enums.SlotTypeEnum;
import com.advertis.types.enums.StrategyStatusEnum;
import com.advertis.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RepositoryImplTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonCodec jsonCodec = new JsonCodec(objectMapper);

    @Test
    public void shouldIncrementVersionAfterSuccessfulUpdate() throws Exception {
        SlotDao slotDao = mock(SlotDao.class);
        AtomicInteger sentVersion = new AtomicInteger(-1);
        when(slotDao.updateWithVersion(any())).thenAnswer(invocation -> {
            sentVersion.set(((SlotPO) invocation.getArgument(0)).getVersion());
            return 1;
        });
        SlotRepositoryImpl repository = new SlotRepositoryImpl(slotDao, jsonCodec);

        SlotEntity slot = newSlot(3);
        slot.writeContent(objectMapper.readTree("{\"scoreCoherence\":60}"), SlotStatusEnum.COMPLETE);
        SlotEntity updated = repository.update(slot);

        ArgumentCaptor<SlotPO> captor = ArgumentCaptor.forClass(SlotPO.class);
        verify(slotDao).updateWithVersion(captor.capture());
        Assertions.assertEquals(3, sentVersion.get());
        Assertions.assertEquals(3, captor.getValue().getVersion());
        Assertions.assertEquals("{\"scoreCoherence\":60}", captor.getValue().getContent());
        Assertions.assertEquals("complete", captor.getValue().getStatus());
        Assertions.assertEquals(4, updated.getVersion());
        Assertions.assertEquals(4, slot.getVersion());
    }

    @Test
    public void shouldRaiseConflictWhenVersionIsStale() {
        SlotDao slotDao = mock(SlotDao.class);
        when(slotDao.updateWithVersion(any())).thenReturn(0);
        SlotRepositoryImpl repository = new SlotRepositoryImpl(slotDao, jsonCodec);

        SlotEntity slot = newSlot(2);
        AppException ex = Assertions.assertThrows(AppException.class, () -> repository.update(slot));

        Assertions.assertEquals(ResponseCode.CONFLICT.getCode(), ex.getCode());
        Assertions.assertEquals(2, slot.getVersion());
    }

    @Test
    public void shouldReadLegacyStringAndOrderByType() {
        SlotDao slotDao = mock(SlotDao.class);
        when(slotDao.selectByStrategyId(7L)).thenReturn(List.of(
                po(2L, "S", "{\"scoreCoherence\":10}"),
                po(1L, "A", "\"Texte libre historique\"")));
        SlotRepositoryImpl repository = new SlotRepositoryImpl(slotDao, jsonCodec);

        List<SlotEntity> slots = repository.findByStrategyId(7L);

        Assertions.assertEquals(SlotTypeEnum.A, slots.get(0).getType());
        Assertions.assertTrue(slots.get(0).getContent().isTextual());
        Assertions.assertEquals("Texte libre historique", slots.get(0).getContent().asText());
        Assertions.assertEquals(10, slots.get(1).getContent().get("scoreCoherence").asInt());
    }

    @Test
    public void shouldReportPhaseCompareAndSetMiss() {
        StrategyDao strategyDao = mock(StrategyDao.class);
        when(strategyDao.updatePhaseIfMatch(5L, "audit-r", "audit-t", "generating")).thenReturn(0);
        when(strategyDao.updatePhaseIfMatch(5L, "audit", "audit-t", "generating")).thenReturn(1);
        StrategyRepositoryImpl repository = new StrategyRepositoryImpl(strategyDao, jsonCodec);

        Assertions.assertFalse(repository.updatePhase(5L, "audit-r", "audit-t", StrategyStatusEnum.GENERATING));
        Assertions.assertTrue(repository.updatePhase(5L, "audit", "audit-t", StrategyStatusEnum.GENERATING));
    }

    private SlotEntity newSlot(int version) {
        SlotEntity slot = SlotEntity.empty(7L, SlotTypeEnum.S);
        slot.setId(70L);
        slot.setVersion(version);
        return slot;
    }

    private SlotPO po(Long id, String type, String content) {
        return SlotPO.builder()
                .id(id)
                .strategyId(7L)
                .type(type)
                .status("complete")
                .content(content)
                .version(1)
                .build();
    }
}
