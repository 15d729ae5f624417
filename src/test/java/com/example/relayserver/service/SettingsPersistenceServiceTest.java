package com.example.relayserver.service;

import com.example.relayserver.exception.IntegrityMismatchException;
import com.example.relayserver.model.ActiveFlagResult;
import com.example.relayserver.model.DetectionMethod;
import com.example.relayserver.model.Equipment;
import com.example.relayserver.model.NormalizedSetting;
import com.example.relayserver.model.NormalizedValue;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.SourceDocument;
import com.example.relayserver.repository.RelaySettingsRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.nio.file.Paths;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

class SettingsPersistenceServiceTest {

    private static final String TAG = "52-MF-02A";

    private JdbcTemplate jdbcTemplate;
    private RelaySettingsRepository repository;
    private SettingsPersistenceService service;

    private final RelayModelProfile profile = new RelayModelProfile();
    private final Equipment equipment = new Equipment(TAG, "MICON_P122", "filename");
    private final SourceDocument document = doc("P122 52-MF-02A.pdf");

    @BeforeEach
    void setUp() {
        // 与生产库相同的 upsert 语法需要 PostgreSQL 兼容模式
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:h2:mem:relay"
                + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        repository = spy(new RelaySettingsRepository(jdbcTemplate));

        service = new SettingsPersistenceService();
        ReflectionTestUtils.setField(service, "repository", repository);
        ReflectionTestUtils.setField(service, "transactionTemplate",
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)));

        profile.setModelCode("MICON_P122");
        profile.setManufacturer("Schneider");
        profile.setDetectionMethod(DetectionMethod.CHECKBOX);
    }

    @AfterEach
    void tearDown() {
        jdbcTemplate.execute("SHUTDOWN");
    }

    private static SourceDocument doc(String fileName) {
        return new SourceDocument(Paths.get(fileName), "abc123", 2048, 3, "", null);
    }

    private static NormalizedSetting setting(String code, NormalizedValue value, SourceDocument source) {
        return setting(code, value, source, TAG);
    }

    private static NormalizedSetting setting(String code, NormalizedValue value, SourceDocument source, String tag) {
        NormalizedSetting setting = new NormalizedSetting(code, "desc " + code, value);
        setting.setDetectionMethod(DetectionMethod.CHECKBOX);
        setting.bindLineage(tag, source.getFileName());
        return setting;
    }

    private static ActiveFlagResult flag(String code, boolean active) {
        return new ActiveFlagResult(code, "function " + code, active, DetectionMethod.CHECKBOX, null, code);
    }

    @Test
    void reprocessingIsIdempotent() {
        NormalizedSetting current = setting("0104", NormalizedValue.numeric(new BigDecimal("2.5"), "A", "2,5 A"), document);
        current.setActive(true);
        List<NormalizedSetting> settings = List.of(current,
                setting("0105", NormalizedValue.bool(true, "Yes"), document),
                setting("0106", NormalizedValue.text("DT"), document));
        List<ActiveFlagResult> flags = List.of(flag("0104", true), flag("0105", false));

        service.persist(profile, equipment, document, null, settings, flags);
        List<NormalizedSetting> first = repository.findSettings(TAG);
        service.persist(profile, equipment, document, null, settings, flags);
        List<NormalizedSetting> second = repository.findSettings(TAG);

        assertThat(second).hasSize(3);
        for (int i = 0; i < first.size(); i++) {
            assertThat(second.get(i).getParameterCode()).isEqualTo(first.get(i).getParameterCode());
            assertThat(second.get(i).getValue()).isEqualTo(first.get(i).getValue());
        }
        NormalizedSetting stored = second.get(0);
        assertThat(stored.getValue()).isEqualTo(current.getValue());
        assertThat(stored.isActive()).isTrue();
        assertThat(stored.getSourceFileName()).isEqualTo("P122 52-MF-02A.pdf");
        assertThat(repository.findActiveFunctions(TAG)).extracting(ActiveFlagResult::isActive)
                .containsExactly(true, false);
        assertThat(repository.findEquipmentTags()).containsExactly(TAG);
    }

    @Test
    void multipartFieldsAreStored() {
        NormalizedSetting part = setting("0150", NormalizedValue.text("tU<"), document);
        part.assignMultipart("Input 1", 2);

        service.persist(profile, equipment, document, null, List.of(part), List.of());

        NormalizedSetting stored = repository.findSettings(TAG).get(0);
        assertThat(stored.isMultipart()).isTrue();
        assertThat(stored.getMultipartBase()).isEqualTo("Input 1");
        assertThat(stored.getMultipartPartIndex()).isEqualTo(2);
    }

    @Test
    void codesNoLongerProducedArePruned() {
        service.persist(profile, equipment, document, null,
                List.of(setting("0104", NormalizedValue.text("a"), document), setting("0105", NormalizedValue.text("b"), document)),
                List.of(flag("0104", true), flag("0105", true)));

        service.persist(profile, equipment, document, null,
                List.of(setting("0104", NormalizedValue.text("a2"), document)),
                List.of(flag("0104", false)));

        assertThat(repository.findParameterCodes(TAG)).containsExactly("0104");
        assertThat(repository.findSettings(TAG).get(0).getValue().getTextValue()).isEqualTo("a2");
        assertThat(repository.findActiveFunctions(TAG)).extracting(ActiveFlagResult::getFunctionCode)
                .containsExactly("0104");
    }

    @Test
    void otherDocumentsOfSameEquipmentAreKept() {
        SourceDocument other = doc("P122 52-MF-02A page2.pdf");

        service.persist(profile, equipment, document, null,
                List.of(setting("0104", NormalizedValue.text("a"), document)), List.of());
        service.persist(profile, equipment, other, null,
                List.of(setting("0200", NormalizedValue.text("b"), other)), List.of());

        assertThat(repository.findParameterCodes(TAG)).containsExactly("0104", "0200");
    }

    @Test
    void countMismatchRollsBackEverything() {
        doReturn(99).when(repository).countSettings(anyString(), anyString());

        assertThatThrownBy(() -> service.persist(profile, equipment, document, null,
                List.of(setting("0104", NormalizedValue.text("a"), document)), List.of(flag("0104", true))))
                .isInstanceOf(IntegrityMismatchException.class)
                .satisfies(e -> {
                    IntegrityMismatchException mismatch = (IntegrityMismatchException) e;
                    assertThat(mismatch.getExpected()).isEqualTo(1);
                    assertThat(mismatch.getActual()).isEqualTo(99);
                });

        assertThat(repository.findEquipmentTags()).isEmpty();
        assertThat(repository.findParameterCodes(TAG)).isEmpty();
        assertThat(repository.findActiveFunctions(TAG)).isEmpty();
    }

    @Test
    void concurrentDocumentsOfSameModelBothCommit() throws Exception {
        String otherTag = "52-MF-03B";
        Equipment otherEquipment = new Equipment(otherTag, "MICON_P122", "filename");
        SourceDocument otherDocument = doc("P122 52-MF-03B.pdf");

        // 第一个事务写入 relay_model 后暂停，保持未提交状态
        CountDownLatch modelWritten = new CountDownLatch(1);
        AtomicBoolean first = new AtomicBoolean(true);
        doAnswer(invocation -> {
            Object result = invocation.callRealMethod();
            if (first.compareAndSet(true, false)) {
                modelWritten.countDown();
                Thread.sleep(300);
            }
            return result;
        }).when(repository).upsertModel(any());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> a = pool.submit(() -> service.persist(profile, equipment, document, null,
                    List.of(setting("0104", NormalizedValue.text("a"), document)), List.of(flag("0104", true))));
            assertThat(modelWritten.await(5, TimeUnit.SECONDS)).isTrue();
            Future<?> b = pool.submit(() -> service.persist(profile, otherEquipment, otherDocument, null,
                    List.of(setting("0104", NormalizedValue.text("b"), otherDocument, otherTag)), List.of()));

            a.get(20, TimeUnit.SECONDS);
            b.get(20, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(repository.findEquipmentTags()).containsExactlyInAnyOrder(TAG, otherTag);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM relay_model", Integer.class)).isEqualTo(1);
        assertThat(repository.findSettings(otherTag)).extracting(st -> st.getValue().getTextValue())
                .containsExactly("b");
    }

    @Test
    void existingRowsAreUpdatedInPlace() {
        service.persist(profile, equipment, document, null,
                List.of(setting("0104", NormalizedValue.text("a"), document)), List.of());
        profile.setManufacturer("Schneider Electric");

        service.persist(profile, equipment, document, null,
                List.of(setting("0104", NormalizedValue.text("a2"), document)), List.of());

        assertThat(jdbcTemplate.queryForObject("SELECT manufacturer FROM relay_model WHERE model_code = ?",
                String.class, "MICON_P122")).isEqualTo("Schneider Electric");
        assertThat(repository.findSettings(TAG)).extracting(st -> st.getValue().getTextValue())
                .containsExactly("a2");
    }
}
