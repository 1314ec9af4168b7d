package com.picframe.cache.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileEnumeratorTest {

    @Test
    void acceptsSupportedExtensionsInAnyCase() {
        assertThat(FileEnumerator.isSupported("/pics", "beach.jpg")).isTrue();
        assertThat(FileEnumerator.isSupported("/pics", "BEACH.JPEG")).isTrue();
        assertThat(FileEnumerator.isSupported("/pics", "scan.png")).isTrue();
        assertThat(FileEnumerator.isSupported("/pics", "phone.HEIC")).isTrue();
        assertThat(FileEnumerator.isSupported("/pics", "phone.heif")).isTrue();
    }

    @Test
    void rejectsOtherFiles() {
        assertThat(FileEnumerator.isSupported("/pics", "notes.txt")).isFalse();
        assertThat(FileEnumerator.isSupported("/pics", "raw.cr2")).isFalse();
        assertThat(FileEnumerator.isSupported("/pics", "noextension")).isFalse();
        assertThat(FileEnumerator.isSupported("/pics", "trailingdot.")).isFalse();
    }

    @Test
    void rejectsHiddenFilesAndAppleSidecars() {
        assertThat(FileEnumerator.isSupported("/pics", ".hidden.jpg")).isFalse();
        assertThat(FileEnumerator.isSupported("/pics/.AppleDouble", "beach.jpg")).isFalse();
    }

    @Test
    void fullNameJoinsFolderBaseAndExtension() {
        assertThat(FileEnumerator.fullName("/pics/2021", "beach", "JPG")).isEqualTo("/pics/2021/beach.JPG");
    }
}
