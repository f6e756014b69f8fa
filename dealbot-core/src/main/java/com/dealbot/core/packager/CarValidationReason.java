package com.dealbot.core.packager;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CarValidationReason {
    ROOT_CID_MISMATCH("root-cid-mismatch"),
    REBUILT_CID_MISMATCH("rebuilt-cid-mismatch"),
    NO_FILES_EXTRACTED("no-files-extracted"),
    UNPACK_ERROR("unpack-error"),
    REBUILD_ERROR("rebuild-error");

    private final String code;

    @Override
    public String toString() {
        return code;
    }
}
