package com.example.relayserver.strategy;

import com.example.relayserver.exception.UnknownModelException;
import com.example.relayserver.model.DetectionMethod;
import com.example.relayserver.model.ModelResolution;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.SourceDocument;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelProfileResolverTest {

    private static RelayModelProfile profile(String code, DetectionMethod method, List<String> extensions,
                                             List<String> filenames, List<String> signatures) {
        RelayModelProfile p = new RelayModelProfile();
        p.setModelCode(code);
        p.setDetectionMethod(method);
        p.setExtensions(extensions);
        p.setFilenamePatterns(filenames);
        p.setContentSignatures(signatures);
        return p;
    }

    private final ModelProfileResolver resolver = new ModelProfileResolver(List.of(
            profile("MICON_P122", DetectionMethod.CHECKBOX, List.of(".pdf"), List.of("P122"), List.of("MiCOM")),
            profile("MICON_P922", DetectionMethod.CHECKBOX, List.of(".PDF"), List.of("P922"), List.of("MiCOM P922")),
            profile("MICON_P143", DetectionMethod.LABELED_FIELD, List.of(".PDF", ".TXT"), List.of("P143"), List.of()),
            profile("SEPAM_S40", DetectionMethod.KEYED_SECTION, List.of(".S40"), List.of(),
                    List.of("(?m)^\\s*\\[Protection\\d+[A-Z]*\\]"))));

    private static SourceDocument doc(String fileName, String content) {
        return new SourceDocument(Paths.get(fileName), "x", 1, 1, content, null);
    }

    @Test
    void longestContentSignatureWins() throws Exception {
        ModelResolution resolution = resolver.resolve(doc("relay.pdf", "Easergy MiCOM P922 settings"));

        assertThat(resolution.getProfile().getModelCode()).isEqualTo("MICON_P922");
        assertThat(resolution.getSignal()).isEqualTo(ModelResolution.Signal.CONTENT);
    }

    @Test
    void contentBeatsFileName() throws Exception {
        ModelResolution resolution = resolver.resolve(doc("P922 52-MF-07A.pdf", "micom p122"));

        assertThat(resolution.getProfile().getModelCode()).isEqualTo("MICON_P122");
    }

    @Test
    void multilineSignatureMatchesSectionHeader() throws Exception {
        ModelResolution resolution = resolver.resolve(doc("export.cfg", "[Identification]\n[Protection50N]\n"));

        assertThat(resolution.getProfile().getModelCode()).isEqualTo("SEPAM_S40");
    }

    @Test
    void uniqueExtensionResolves() throws Exception {
        ModelResolution s40 = resolver.resolve(doc("00-MF-12.s40", ""));
        ModelResolution txt = resolver.resolve(doc("export.txt", ""));

        assertThat(s40.getProfile().getModelCode()).isEqualTo("SEPAM_S40");
        assertThat(s40.getSignal()).isEqualTo(ModelResolution.Signal.EXTENSION);
        assertThat(txt.getProfile().getModelCode()).isEqualTo("MICON_P143");
    }

    @Test
    void fileNameDecidesAmongProfilesSharingExtension() throws Exception {
        ModelResolution resolution = resolver.resolve(doc("P122 52-MF-02A_2021-03-17.pdf", ""));

        assertThat(resolution.getProfile().getModelCode()).isEqualTo("MICON_P122");
        assertThat(resolution.getSignal()).isEqualTo(ModelResolution.Signal.FILENAME);
    }

    @Test
    void fileNameAloneIsNotEnough() {
        assertThatThrownBy(() -> resolver.resolve(doc("P122 52-MF-02A.docx", "")))
                .isInstanceOf(UnknownModelException.class);
    }

    @Test
    void unknownPdfIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(doc("scan.pdf", "nothing useful")))
                .isInstanceOf(UnknownModelException.class);
    }
}
