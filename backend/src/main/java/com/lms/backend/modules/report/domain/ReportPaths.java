package com.lms.backend.modules.report.domain;

import java.nio.file.Path;

public record ReportPaths(Path jsonPath, Path textPath) {
}
