package com.project.image.mosaic;

import com.project.image.mosaic.DTOs.ImageFormat;
import com.project.image.mosaic.DTOs.MosaicRequest;
import com.project.image.mosaic.DTOs.MosaicStatus;
import com.project.image.mosaic.runner.MosaicCommandLineRunner;
import com.project.image.mosaic.service.Compositor;
import com.project.image.mosaic.service.ImageCodecService;
import com.project.image.mosaic.service.MosaicOrchestrator;
import com.project.image.mosaic.service.PixelSampler;
import com.project.image.mosaic.service.SeedCatalogService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class MosaicCommandLineRunnerTest {
    private final ImageCodecService codec = new ImageCodecService();
    private final PixelSampler sampler = new PixelSampler();
    private final MosaicCommandLineRunner runner = new MosaicCommandLineRunner(new MosaicOrchestrator(
            codec, new SeedCatalogService(codec, sampler), sampler, new Compositor(), 2, 10));

    @Test
    void run_withArguments_writesMosaic() throws Exception {
        Path tmp = Files.createTempDirectory("runner-test");
        Path master = TestImages.write(tmp, "master.png", TestImages.solid(60, 30, Color.YELLOW), "png");
        Path seeds = tmp.resolve("seeds");
        TestImages.writePng(seeds, "y.png", Color.YELLOW);
        TestImages.writePng(seeds, "k.png", Color.BLACK);
        Path out = tmp.resolve("mosaic.jpg");

        runner.run(new DefaultApplicationArguments(
                "--master=" + master, "--seeds=" + seeds, "--output=" + out,
                "--strategy=color", "--tile-width=20", "--tile-height=15", "--quality=90"));

        assertThat(runner.getLastResult().status()).isEqualTo(MosaicStatus.COMPLETED);
        assertThat(runner.getLastResult().statistics().totalTiles()).isEqualTo(6);
        assertThat(Files.exists(out)).isTrue();
        assertThat(codec.sniffFormat(out)).contains(ImageFormat.JPEG);
        assertThat(tmp.resolve("mosaic_thumb.jpg")).exists();
    }

    @Test
    void toRequest_thumbnailOptions() {
        MosaicRequest sized = MosaicCommandLineRunner.toRequest(new DefaultApplicationArguments(
                "--master=m.png", "--thumbnail-width=320", "--thumbnail-height=200"));
        MosaicRequest disabled = MosaicCommandLineRunner.toRequest(new DefaultApplicationArguments(
                "--master=m.png", "--no-thumbnail"));

        assertThat(sized.createThumbnail()).isTrue();
        assertThat(sized.thumbnailMaxWidth()).isEqualTo(320);
        assertThat(sized.thumbnailMaxHeight()).isEqualTo(200);
        assertThat(disabled.createThumbnail()).isFalse();
        assertThat(disabled.thumbnailMaxWidth()).isEqualTo(MosaicRequest.DEFAULT_THUMBNAIL_MAX_WIDTH);
    }

    @Test
    void run_withoutMaster_doesNothing() {
        runner.run(new DefaultApplicationArguments("--seeds=/tmp"));

        assertThat(runner.getLastResult()).isNull();
    }

    @Test
    void run_badNumber_doesNotStartRun() {
        runner.run(new DefaultApplicationArguments("--master=m.png", "--tile-width=wide"));

        assertThat(runner.getLastResult()).isNull();
    }

    @Test
    void run_missingMasterFile_reportsFailure() {
        runner.run(new DefaultApplicationArguments("--master=/definitely/missing.png", "--flat"));

        assertThat(runner.getLastResult().status()).isEqualTo(MosaicStatus.FAILED);
    }
}
