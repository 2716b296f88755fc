package io.mersel.services.testcase.infrastructure;

import io.mersel.services.testcase.infrastructure.config.TestcaseProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TestcaseProperties birim testleri.
 * <p>
 * @PostConstruct validate() metodunun geçersiz değerleri varsayılana geri döndürdüğünü test eder.
 */
@DisplayName("TestcaseProperties")
class TestcasePropertiesTest {

    @Test
    @DisplayName("varsayilan_degerler: kök, limit ve MIME listesi dolu")
    void varsayilan_degerler() {
        var props = new TestcaseProperties();

        assertThat(props.getInstancesRoot()).isEqualTo("./instances");
        assertThat(props.getReport().getRecentItemLimit()).isEqualTo(20);
        assertThat(props.getAttachments().getAllowedMimeTypes())
                .contains("application/pdf", "image/png", "text/plain")
                .hasSize(16);
    }

    @Test
    @DisplayName("validate_gecerli_degerler: geçerli değerler korunur")
    void validate_gecerli_degerler() throws Exception {
        var props = new TestcaseProperties();
        props.setInstancesRoot("/srv/instances");
        props.getReport().setRecentItemLimit(5);
        props.getAttachments().setAllowedMimeTypes(List.of("text/plain"));

        invokeValidate(props);

        assertThat(props.getInstancesRoot()).isEqualTo("/srv/instances");
        assertThat(props.getReport().getRecentItemLimit()).isEqualTo(5);
        assertThat(props.getAttachments().getAllowedMimeTypes()).containsExactly("text/plain");
    }

    @Test
    @DisplayName("validate_gecersiz_degerler: boş kök, sıfır limit, boş liste varsayılana döner")
    void validate_gecersiz_degerler() throws Exception {
        var props = new TestcaseProperties();
        props.setInstancesRoot("  ");
        props.getReport().setRecentItemLimit(0);
        props.getAttachments().setAllowedMimeTypes(new ArrayList<>());

        invokeValidate(props);

        assertThat(props.getInstancesRoot()).isEqualTo("./instances");
        assertThat(props.getReport().getRecentItemLimit()).isEqualTo(20);
        assertThat(props.getAttachments().getAllowedMimeTypes()).hasSize(16);
    }

    private void invokeValidate(TestcaseProperties props) throws Exception {
        Method validate = TestcaseProperties.class.getDeclaredMethod("validate");
        validate.setAccessible(true);
        validate.invoke(props);
    }
}
