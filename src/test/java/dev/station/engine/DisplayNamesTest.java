package dev.station.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DisplayNamesTest {

    @Test
    void splitsCamelCaseIdentifiers() {
        assertThat(DisplayNames.fromIdentifier("EmptyStep")).isEqualTo("Empty Step");
        assertThat(DisplayNames.fromIdentifier("StepWithDisplayName")).isEqualTo("Step With Display Name");
    }

    @Test
    void keepsAcronymsTogether() {
        assertThat(DisplayNames.fromIdentifier("ConnectToDUTNow")).isEqualTo("Connect To DUT Now");
        assertThat(DisplayNames.fromIdentifier("ReadADC")).isEqualTo("Read ADC");
    }

    @Test
    void splitsAfterDigits() {
        assertThat(DisplayNames.fromIdentifier("Check3V3Rail")).isEqualTo("Check3 V3 Rail");
    }

    @Test
    void treatsUnderscoresAsSpaces() {
        assertThat(DisplayNames.fromIdentifier("flash_firmware")).isEqualTo("flash firmware");
    }

    @Test
    void singleWordIsUnchanged() {
        assertThat(DisplayNames.fromIdentifier("Shutdown")).isEqualTo("Shutdown");
    }

    @Test
    void rejectsBlankIdentifier() {
        assertThatThrownBy(() -> DisplayNames.fromIdentifier(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
