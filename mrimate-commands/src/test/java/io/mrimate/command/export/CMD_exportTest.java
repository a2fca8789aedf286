package io.mrimate.command.export;

/*
 * Copyright (c) mrimate
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.mrimate.command.CommandRun;
import io.mrimate.command.ParRecFixture;
import io.mrimate.command.ParRecFixture.Row;
import io.mrimate.hdf5.ContainerReader;
import io.mrimate.hdf5.ExportedContainer;
import io.mrimate.parrec.model.ImageType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CMD_exportTest {

    @TempDir
    Path tempDir;

    private Path writeScan() throws IOException {
        return ParRecFixture.twoSlices()
            .row(new Row().slice(1).type(3).fill(2048).rescale(-2048.0, 0.001, 1.0))
            .rawLine("  1 1 1 1 0 2 7 16")
            .write(tempDir, "scan");
    }

    @Test
    public void testExportWritesContainerBesideScan() throws IOException {
        Path par = writeScan();

        CommandRun run = CommandRun.of("export", par.toString());

        assertEquals(0, run.exitCode, run.err);
        Path target = tempDir.resolve("scan.h5");
        assertTrue(run.out.contains("wrote " + target), run.out);
        assertTrue(run.err.contains("WARNING: MALFORMED_RECORD"), run.err);
        ExportedContainer container = new ContainerReader().read(target);
        assertEquals(2, container.images().size());
        assertTrue(container.image(ImageType.PHASE).isPresent());
    }

    @Test
    public void testExportToExplicitOutputWithThreads() throws IOException {
        Path par = writeScan();
        Path target = tempDir.resolve("out/explicit.h5");

        CommandRun run = CommandRun.of("export", par.toString(), "-o", target.toString(),
            "--threads", "2", "-v");

        assertEquals(0, run.exitCode, run.err);
        assertTrue(Files.isRegularFile(target));
        assertTrue(run.out.contains("magnitude [64, 64, 2, 1, 1, 1] counts"), run.out);
        assertTrue(run.out.contains("phase [64, 64, 1, 1, 1, 1] radians"), run.out);
    }

    @Test
    public void testExportWithSeparateRecFile() throws IOException {
        ParRecFixture fixture = ParRecFixture.twoSlices();
        Path par = fixture.write(tempDir, "scan", new byte[0]);
        Path rec = tempDir.resolve("data.bin");
        Files.write(rec, fixture.recBytes());

        CommandRun run = CommandRun.of("export", par.toString(), "--rec", rec.toString());

        assertEquals(0, run.exitCode, run.err);
    }

    @Test
    public void testQuietExportPrintsNothing() throws IOException {
        Path par = writeScan();

        CommandRun run = CommandRun.of("export", par.toString(), "-q");

        assertEquals(0, run.exitCode);
        assertTrue(run.out.isEmpty(), run.out);
        assertFalse(run.err.contains("WARNING"), run.err);
    }

    @Test
    public void testTruncatedScanExitsWithScanError() throws IOException {
        ParRecFixture fixture = ParRecFixture.twoSlices();
        byte[] rec = fixture.recBytes();
        Path par = fixture.write(tempDir, "scan", Arrays.copyOf(rec, 100));

        CommandRun run = CommandRun.of("export", par.toString());

        assertEquals(CMD_export.EXIT_SCAN, run.exitCode);
        assertTrue(run.err.startsWith("ERROR: "), run.err);
        assertTrue(run.err.contains("scan.PAR"), run.err);
        assertFalse(Files.exists(tempDir.resolve("scan.h5")));
    }

    @Test
    public void testBadConfigExitsWithConfigError() throws IOException {
        Path par = writeScan();
        Path config = tempDir.resolve("pipeline.yaml");
        Files.writeString(config, "threads: 2\nspeed: fast\n");

        CommandRun run = CommandRun.of("export", par.toString(), "--config", config.toString());

        assertEquals(CMD_export.EXIT_CONFIG, run.exitCode);
        assertTrue(run.err.contains("speed"), run.err);
    }

    @Test
    public void testConfigFileIsApplied() throws IOException {
        Path par = writeScan();
        Path config = tempDir.resolve("pipeline.json");
        Files.writeString(config, "{\"threads\": 3, \"exportTempPrefix\": \".scan-\"}");

        CommandRun run = CommandRun.of("export", par.toString(), "--config", config.toString());

        assertEquals(0, run.exitCode, run.err);
    }

    @Test
    public void testUnwritableTargetExitsWithExportError() throws IOException {
        Path par = writeScan();
        Path blocked = tempDir.resolve("blocked.h5");
        Files.createDirectories(blocked.resolve("inner"));

        CommandRun run = CommandRun.of("export", par.toString(), "-o", blocked.toString());

        assertEquals(CMD_export.EXIT_EXPORT, run.exitCode);
        assertTrue(run.err.contains("ERROR: unable to export"), run.err);
    }

    @Test
    public void testVerboseAndQuietAreExclusive() throws IOException {
        Path par = writeScan();

        CommandRun run = CommandRun.of("export", par.toString(), "-v", "-q");

        assertEquals(2, run.exitCode);
        assertTrue(run.err.contains("Cannot specify both --verbose and --quiet"), run.err);
    }

    @Test
    public void testDefaultOutputSwapsExtension() {
        assertEquals(Path.of("/data/brain.h5"), CMD_export.defaultOutput(Path.of("/data/brain.PAR")));
        assertEquals(Path.of("brain.h5"), CMD_export.defaultOutput(Path.of("brain")));
    }
}
