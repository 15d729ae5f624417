package com.example.relayserver.repository;

import com.example.relayserver.model.ActiveFlagResult;
import com.example.relayserver.model.DetectionMethod;
import com.example.relayserver.model.Equipment;
import com.example.relayserver.model.NormalizedSetting;
import com.example.relayserver.model.NormalizedValue;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.SourceDocument;
import com.example.relayserver.model.ValueType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 整定值持久化
 *
 * 所有写操作都是幂等的 upsert：INSERT ... ON CONFLICT DO NOTHING，键已存在时再 UPDATE。
 * PostgreSQL 原生支持；H2 需要 MODE=PostgreSQL。调用方负责把一个文档的全部写操作放进同一个事务。
 */
@Repository
public class RelaySettingsRepository {

    private static final RowMapper<NormalizedSetting> SETTING_MAPPER = (rs, rowNum) -> {
        NormalizedValue value = new NormalizedValue(
                rs.getBigDecimal("value_numeric"),
                rs.getString("value_text"),
                rs.getString("unit"),
                ValueType.valueOf(rs.getString("value_type")),
                rs.getString("original_text"));
        NormalizedSetting setting = new NormalizedSetting(
                rs.getString("parameter_code"), rs.getString("description"), value);
        if (rs.getBoolean("is_multipart")) {
            setting.assignMultipart(rs.getString("multipart_base"), rs.getInt("multipart_part"));
        }
        setting.setActive(rs.getBoolean("is_active"));
        String method = rs.getString("detection_method");
        if (method != null) {
            setting.setDetectionMethod(DetectionMethod.valueOf(method));
        }
        setting.bindLineage(rs.getString("equipment_tag"), rs.getString("source_file"));
        return setting;
    };

    private final JdbcTemplate jdbcTemplate;

    public RelaySettingsRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsertModel(RelayModelProfile profile) {
        upsert("INSERT INTO relay_model (model_code, manufacturer, detection_method) VALUES (?, ?, ?)",
                new Object[]{profile.getModelCode(), profile.getManufacturer(), profile.getDetectionMethod().name()},
                "UPDATE relay_model SET manufacturer = ?, detection_method = ? WHERE model_code = ?",
                new Object[]{profile.getManufacturer(), profile.getDetectionMethod().name(), profile.getModelCode()});
    }

    public void upsertEquipment(Equipment equipment) {
        Timestamp now = Timestamp.from(Instant.now());
        upsert("INSERT INTO equipment (tag, model_code, tag_source, updated_at) VALUES (?, ?, ?, ?)",
                new Object[]{equipment.getTag(), equipment.getModelCode(), equipment.getTagSource(), now},
                "UPDATE equipment SET model_code = ?, tag_source = ?, updated_at = ? WHERE tag = ?",
                new Object[]{equipment.getModelCode(), equipment.getTagSource(), now, equipment.getTag()});
    }

    public void upsertDocument(SourceDocument document, String equipmentTag, String encoding) {
        Timestamp now = Timestamp.from(Instant.now());
        upsert("INSERT INTO source_document (file_name, equipment_tag, checksum, size_bytes, page_count, "
                        + "encoding, processed_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
                new Object[]{document.getFileName(), equipmentTag, document.getChecksum(), document.getSize(),
                        document.getPageCount(), encoding, now},
                "UPDATE source_document SET equipment_tag = ?, checksum = ?, size_bytes = ?, page_count = ?, "
                        + "encoding = ?, processed_at = ? WHERE file_name = ?",
                new Object[]{equipmentTag, document.getChecksum(), document.getSize(), document.getPageCount(),
                        encoding, now, document.getFileName()});
    }

    /**
     * 按 (设备, 参数代码) upsert
     */
    public void upsertSetting(NormalizedSetting s) {
        NormalizedValue v = s.getValue();
        Timestamp now = Timestamp.from(Instant.now());
        String method = s.getDetectionMethod() == null ? null : s.getDetectionMethod().name();
        upsert("INSERT INTO relay_setting (equipment_tag, parameter_code, description, value_numeric, "
                        + "value_text, unit, value_type, original_text, is_multipart, multipart_base, "
                        + "multipart_part, is_active, detection_method, source_file, updated_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                new Object[]{s.getEquipmentTag(), s.getParameterCode(), s.getDescription(), v.getNumericValue(),
                        v.getTextValue(), v.getUnit(), v.getValueType().name(), v.getOriginalText(),
                        s.isMultipart(), s.getMultipartBase(), s.getMultipartPartIndex(), s.isActive(),
                        method, s.getSourceFileName(), now},
                "UPDATE relay_setting SET description = ?, value_numeric = ?, value_text = ?, unit = ?, "
                        + "value_type = ?, original_text = ?, is_multipart = ?, multipart_base = ?, "
                        + "multipart_part = ?, is_active = ?, detection_method = ?, source_file = ?, updated_at = ? "
                        + "WHERE equipment_tag = ? AND parameter_code = ?",
                new Object[]{s.getDescription(), v.getNumericValue(), v.getTextValue(), v.getUnit(),
                        v.getValueType().name(), v.getOriginalText(), s.isMultipart(), s.getMultipartBase(),
                        s.getMultipartPartIndex(), s.isActive(), method, s.getSourceFileName(), now,
                        s.getEquipmentTag(), s.getParameterCode()});
    }

    /**
     * 按 (设备, 功能代码) upsert
     */
    public void upsertActiveFunction(String equipmentTag, String sourceFileName, ActiveFlagResult flag) {
        upsert("INSERT INTO active_function (equipment_tag, function_code, description, is_active, "
                        + "detection_method, group_index, source_file) VALUES (?, ?, ?, ?, ?, ?, ?)",
                new Object[]{equipmentTag, flag.getFunctionCode(), flag.getDescription(), flag.isActive(),
                        flag.getDetectionMethod().name(), flag.getGroupIndex(), sourceFileName},
                "UPDATE active_function SET description = ?, is_active = ?, detection_method = ?, group_index = ?, "
                        + "source_file = ? WHERE equipment_tag = ? AND function_code = ?",
                new Object[]{flag.getDescription(), flag.isActive(), flag.getDetectionMethod().name(),
                        flag.getGroupIndex(), sourceFileName, equipmentTag, flag.getFunctionCode()});
    }

    /**
     * 先 INSERT ... ON CONFLICT DO NOTHING，未插入（键已存在）时再 UPDATE
     *
     * 并发事务插入同一个键时，后到的 INSERT 等待先到的事务提交后什么也不做，不会抛出唯一键冲突。
     */
    private void upsert(String insertSql, Object[] insertArgs, String updateSql, Object[] updateArgs) {
        int inserted = jdbcTemplate.update(insertSql + " ON CONFLICT DO NOTHING", insertArgs);
        if (inserted == 0) {
            jdbcTemplate.update(updateSql, updateArgs);
        }
    }

    /**
     * 删除该文档以前写入、本次不再产出的参数
     *
     * @return 删除行数
     */
    public int pruneSettings(String equipmentTag, String sourceFileName, Set<String> keepCodes) {
        List<String> existing = jdbcTemplate.queryForList(
                "SELECT parameter_code FROM relay_setting WHERE equipment_tag = ? AND source_file = ?",
                String.class, equipmentTag, sourceFileName);
        int deleted = 0;
        for (String code : existing) {
            if (!keepCodes.contains(code)) {
                deleted += jdbcTemplate.update(
                        "DELETE FROM relay_setting WHERE equipment_tag = ? AND parameter_code = ?", equipmentTag, code);
            }
        }
        return deleted;
    }

    public int pruneActiveFunctions(String equipmentTag, String sourceFileName, Set<String> keepCodes) {
        List<String> existing = jdbcTemplate.queryForList(
                "SELECT function_code FROM active_function WHERE equipment_tag = ? AND source_file = ?",
                String.class, equipmentTag, sourceFileName);
        int deleted = 0;
        for (String code : existing) {
            if (!keepCodes.contains(code)) {
                deleted += jdbcTemplate.update(
                        "DELETE FROM active_function WHERE equipment_tag = ? AND function_code = ?", equipmentTag, code);
            }
        }
        return deleted;
    }

    public int countSettings(String equipmentTag, String sourceFileName) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM relay_setting WHERE equipment_tag = ? AND source_file = ?",
                Integer.class, equipmentTag, sourceFileName);
        return count == null ? 0 : count;
    }

    public int countActiveFunctions(String equipmentTag, String sourceFileName) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM active_function WHERE equipment_tag = ? AND source_file = ?",
                Integer.class, equipmentTag, sourceFileName);
        return count == null ? 0 : count;
    }

    public List<NormalizedSetting> findSettings(String equipmentTag) {
        return jdbcTemplate.query(
                "SELECT * FROM relay_setting WHERE equipment_tag = ? ORDER BY parameter_code",
                SETTING_MAPPER, equipmentTag);
    }

    public List<ActiveFlagResult> findActiveFunctions(String equipmentTag) {
        return jdbcTemplate.query(
                "SELECT * FROM active_function WHERE equipment_tag = ? ORDER BY function_code",
                (rs, rowNum) -> new ActiveFlagResult(
                        rs.getString("function_code"),
                        rs.getString("description"),
                        rs.getBoolean("is_active"),
                        DetectionMethod.valueOf(rs.getString("detection_method")),
                        rs.getObject("group_index", Integer.class),
                        null),
                equipmentTag);
    }

    public Set<String> findEquipmentTags() {
        return new HashSet<>(jdbcTemplate.queryForList("SELECT tag FROM equipment", String.class));
    }

    /**
     * 测试与排查用：某设备的全部参数代码
     */
    public List<String> findParameterCodes(String equipmentTag) {
        return new ArrayList<>(jdbcTemplate.queryForList(
                "SELECT parameter_code FROM relay_setting WHERE equipment_tag = ? ORDER BY parameter_code",
                String.class, equipmentTag));
    }
}
