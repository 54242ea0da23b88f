package com.labvault.api.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BackupDownload {

    private final String filename;
    private final byte[] content;
}
