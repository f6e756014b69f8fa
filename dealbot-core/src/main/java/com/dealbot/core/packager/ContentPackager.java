package com.dealbot.core.packager;

import com.dealbot.common.constants.ProbeDefaults;
import com.dealbot.common.util.FileUtils;
import com.dealbot.common.util.LogFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds content-addressed CARs for test payloads and proves them by unpacking and rebuilding.
 * All intermediate files live in a private scratch directory removed on every exit path.
 */
@Component
@Slf4j
public class ContentPackager {

    private final Path scratchParent;
    private final UnixFsImporter importer;

    public ContentPackager(@Value("${dealbot.dataset.scratch-directory:}") String scratchDirectory) {
        this(scratchDirectory == null || scratchDirectory.isBlank() ? null : Path.of(scratchDirectory),
            new UnixFsImporter());
    }

    ContentPackager(Path scratchParent, UnixFsImporter importer) {
        this.scratchParent = scratchParent;
        this.importer = importer;
    }

    public ContentPackage build(DataFile dataFile) {
        long startTime = System.currentTimeMillis();
        String safeName = FileUtils.sanitizeFileName(dataFile.getName());
        byte[] payload = dataFile.getData() != null ? dataFile.getData() : new byte[0];

        Path scratch = null;
        try {
            scratch = FileUtils.createScratchDirectory(scratchParent, ProbeDefaults.SCRATCH_PREFIX);
            Path file = scratch.resolve(safeName);
            Files.write(file, payload);

            UnixFsImporter.ImportResult imported = importer.importFile(file);
            byte[] car = CarWriter.write(imported.root(), imported.blocks());

            List<String> blockCids = imported.blocks().stream().map(b -> b.cid().toString()).toList();
            ContentPackage result = ContentPackage.builder()
                .rootCid(imported.root().toString())
                .blockCids(blockCids)
                .blockCount(blockCids.size())
                .totalBlockSize(imported.totalBlockSize())
                .originalSize(payload.length)
                .carBytes(car)
                .build();

            log.info("[PACKAGER] CAR built | name={} | rootCid={} | blocks={} | carBytes={} | durationMs={}",
                safeName, LogFormat.abbreviate(result.getRootCid(), 20), result.getBlockCount(), car.length,
                System.currentTimeMillis() - startTime);
            return result;

        } catch (IOException e) {
            throw new PackagingException("Failed to build CAR for " + safeName + ": " + e.getMessage(), e);
        } finally {
            cleanup(scratch);
        }
    }

    /**
     * Unpacks the CAR, exports the DAG at its declared root, and rebuilds it. Never throws on bad input;
     * every problem is reported as a reason on the result.
     */
    public CarValidationResult validate(byte[] carBytes, String expectedRootCid) {
        CarValidationResult.CarValidationResultBuilder result = CarValidationResult.builder();
        List<CarValidationReason> reasons = new ArrayList<>();

        Path scratch = null;
        try {
            CarReader.CarContents contents;
            Cid declaredRoot;
            List<Path> extracted;
            Path exportTarget;
            boolean directory;
            try {
                scratch = FileUtils.createScratchDirectory(scratchParent, ProbeDefaults.SCRATCH_PREFIX);
                contents = CarReader.read(carBytes, ProbeDefaults.MAX_BLOCK_SIZE_BYTES);
                declaredRoot = contents.roots().get(0);
                result.declaredRootCid(declaredRoot.toString());

                UnixFsExporter exporter = new UnixFsExporter(contents.blocks());
                directory = exporter.isDirectory(declaredRoot);
                exportTarget = scratch.resolve(declaredRoot.toString());
                extracted = exporter.export(declaredRoot, exportTarget);
            } catch (IOException | RuntimeException e) {
                return fail(result, reasons, CarValidationReason.UNPACK_ERROR, e.getMessage());
            }

            if (!declaredRoot.toString().equals(expectedRootCid)) {
                reasons.add(CarValidationReason.ROOT_CID_MISMATCH);
                result.detail("CAR root " + declaredRoot + " does not match expected " + expectedRootCid);
            }

            result.extractedFiles(extracted.size());
            if (extracted.isEmpty()) {
                return fail(result, reasons, CarValidationReason.NO_FILES_EXTRACTED, "No files extracted from CAR");
            }

            try {
                UnixFsImporter.ImportResult rebuilt = directory
                    ? importer.importDirectory(exportTarget)
                    : importer.importFile(exportTarget);
                result.rebuiltRootCid(rebuilt.root().toString());
                if (!rebuilt.root().toString().equals(expectedRootCid)) {
                    reasons.add(CarValidationReason.REBUILT_CID_MISMATCH);
                    result.detail("Rebuilt root " + rebuilt.root() + " does not match expected " + expectedRootCid);
                }
            } catch (IOException | RuntimeException e) {
                return fail(result, reasons, CarValidationReason.REBUILD_ERROR, e.getMessage());
            }

            CarValidationResult validation = result.reasons(reasons).valid(reasons.isEmpty()).build();
            if (validation.isValid()) {
                log.debug("[PACKAGER] CAR validated | rootCid={} | files={}",
                    LogFormat.abbreviate(expectedRootCid, 20), extracted.size());
            } else {
                log.warn("[PACKAGER] CAR validation failed | expectedRootCid={} | reasons={}",
                    expectedRootCid, validation.reasonCodes());
            }
            return validation;
        } finally {
            cleanup(scratch);
        }
    }

    private CarValidationResult fail(CarValidationResult.CarValidationResultBuilder result,
                                     List<CarValidationReason> reasons,
                                     CarValidationReason reason,
                                     String detail) {
        reasons.add(reason);
        result.detail(reason.getCode() + ": " + detail);
        log.warn("[PACKAGER] CAR validation failed | reason={} | error={}", reason.getCode(), detail);
        return result.reasons(reasons).valid(false).build();
    }

    private void cleanup(Path scratch) {
        try {
            FileUtils.deleteRecursively(scratch);
        } catch (IOException e) {
            log.warn("[PACKAGER] Failed to remove scratch directory | path={} | error={}", scratch, e.getMessage());
        }
    }
}
