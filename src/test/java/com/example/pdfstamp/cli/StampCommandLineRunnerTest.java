package com.example.pdfstamp.cli;

import com.example.pdfstamp.core.InvocationSerializer;
import com.example.pdfstamp.exception.ConfigException;
import com.example.pdfstamp.model.DensitySource;
import com.example.pdfstamp.model.Invocation;
import com.example.pdfstamp.model.PlacementSnapshot;
import com.example.pdfstamp.model.StampJob;
import com.example.pdfstamp.model.StampResolution;
import com.example.pdfstamp.model.StampResult;
import com.example.pdfstamp.service.PdfStampService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StampCommandLineRunnerTest {

    @Test
    void acceptsSeparateAndInlineValues() {
        Map<String, String> options = StampCommandLineRunner.options(new String[]{
                "--input", "a.pdf", "--stamp=b.png", "--page", "-2", "--x", "-3.5", "--scale=0.5"});

        assertThat(options).containsEntry("input", "a.pdf")
                .containsEntry("stamp", "b.png")
                .containsEntry("page", "-2")
                .containsEntry("x", "-3.5")
                .containsEntry("scale", "0.5");
    }

    @Test
    void zeroDensityMeansProbeMetadata() {
        StampJob job = StampCommandLineRunner.parse(StampCommandLineRunner.options(new String[]{
                "--input", "a.pdf", "--stamp", "b.png", "--stamp-dpi", "0"}));

        assertThat(job.getStampDpi()).isNull();
        assertThat(job.getPage()).isEqualTo(1);
        assertThat(job.getScale()).isEqualTo(1.0);
        assertThat(job.getOutput()).isNull();
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> parse("--input", "a.pdf")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> parse("--input", "a.pdf", "--stamp", "b.png", "--page", "0"))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> parse("--input", "a.pdf", "--stamp", "b.png", "--stamp-dpi", "-1"))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> parse("--input", "a.pdf", "--stamp", "b.png", "--x", "left"))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> parse("a.pdf")).isInstanceOf(ConfigException.class);
    }

    @Test
    void serializedInvocationParsesBackToSameJob() {
        Invocation invocation = InvocationSerializer.serialize(
                Paths.get("in.pdf"), Paths.get("sig.png"),
                new StampResolution(300.0, DensitySource.EXPLICIT), -1,
                new PlacementSnapshot(10.0, 5.0, 2.5, 0.0, 0.75), Paths.get("out.pdf"));

        StampJob job = parse(invocation.toArgs().toArray(new String[0]));

        assertThat(job.getInput()).isEqualTo(Paths.get("in.pdf"));
        assertThat(job.getStamp()).isEqualTo(Paths.get("sig.png"));
        assertThat(job.getStampDpi()).isEqualTo(300.0);
        assertThat(job.getPage()).isEqualTo(-1);
        assertThat(job.getX()).isEqualTo(12.5);
        assertThat(job.getY()).isEqualTo(5.0);
        assertThat(job.getScale()).isEqualTo(0.75);
        assertThat(job.getOutput()).isEqualTo(Paths.get("out.pdf"));
    }

    @Test
    void runsOnlyWithInputOption() {
        PdfStampService service = mock(PdfStampService.class);
        when(service.stamp(any())).thenReturn(new StampResult("out.pdf", 1,
                new StampResolution(72.0, DensitySource.FALLBACK), List.of(PdfStampService.FALLBACK_WARNING), 5));
        StampCommandLineRunner runner = new StampCommandLineRunner();
        ReflectionTestUtils.setField(runner, "pdfStampService", service);

        runner.run(new DefaultApplicationArguments("--server.port=9090"));
        verify(service, never()).stamp(any());

        runner.run(new DefaultApplicationArguments("--input", "in.pdf", "--stamp", "sig.png", "--y", "7"));
        ArgumentCaptor<StampJob> job = ArgumentCaptor.forClass(StampJob.class);
        verify(service).stamp(job.capture());
        assertThat(job.getValue().getY()).isEqualTo(7.0);
    }

    private static StampJob parse(String... args) {
        return StampCommandLineRunner.parse(StampCommandLineRunner.options(args));
    }
}
