package com.example.relayserver.service;

import com.example.relayserver.exception.IntegrityMismatchException;
import com.example.relayserver.model.ActiveFlagResult;
import com.example.relayserver.model.Equipment;
import com.example.relayserver.model.NormalizedSetting;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.SourceDocument;
import com.example.relayserver.repository.RelaySettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 单文档持久化
 *
 * 一个文档的全部写入（型号、设备、文档、参数、激活功能、清理旧行）在同一个事务内完成。
 * 写入后按 (设备, 来源文档) 回查行数，与本次产出不一致时抛出 IntegrityMismatchException，整个事务回滚。
 */
@Slf4j
@Service
public class SettingsPersistenceService {

    @Autowired
    private RelaySettingsRepository repository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    public void persist(RelayModelProfile profile, Equipment equipment, SourceDocument document, String encoding,
                        List<NormalizedSetting> settings, List<ActiveFlagResult> flags) {
        String tag = equipment.getTag();
        String fileName = document.getFileName();

        transactionTemplate.executeWithoutResult(status -> {
            repository.upsertModel(profile);
            repository.upsertEquipment(equipment);
            repository.upsertDocument(document, tag, encoding);

            Set<String> settingCodes = new HashSet<>();
            for (NormalizedSetting setting : settings) {
                repository.upsertSetting(setting);
                settingCodes.add(setting.getParameterCode());
            }
            Set<String> functionCodes = new HashSet<>();
            for (ActiveFlagResult flag : flags) {
                repository.upsertActiveFunction(tag, fileName, flag);
                functionCodes.add(flag.getFunctionCode());
            }

            int prunedSettings = repository.pruneSettings(tag, fileName, settingCodes);
            int prunedFunctions = repository.pruneActiveFunctions(tag, fileName, functionCodes);
            if (prunedSettings > 0 || prunedFunctions > 0) {
                log.info("[{}] 清理旧记录: 参数 {} 行, 激活功能 {} 行", fileName, prunedSettings, prunedFunctions);
            }

            int actualSettings = repository.countSettings(tag, fileName);
            if (actualSettings != settingCodes.size()) {
                throw new IntegrityMismatchException(tag, settingCodes.size(), actualSettings);
            }
            int actualFunctions = repository.countActiveFunctions(tag, fileName);
            if (actualFunctions != functionCodes.size()) {
                throw new IntegrityMismatchException(tag, functionCodes.size(), actualFunctions);
            }
        });

        log.info("[{}] 写入完成: 设备 {}, 参数 {} 行, 激活功能 {} 行", fileName, tag, settings.size(), flags.size());
    }
}
