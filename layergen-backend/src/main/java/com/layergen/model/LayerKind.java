package com.layergen.model;

/**
 * Architectural slice generated for every table.
 *
 * <p>The declaration order is the order in which layers appear in a report.
 */
public enum LayerKind {
    ENTITY_BASE("base entity", "model", "Base%s.java", "java"),
    ENTITY_IMPL("entity", "model", "%s.java", "java"),
    DATA_ACCESS_INTERFACE("mapper interface", "mapper", "%sMapper.java", "java"),
    SERVICE_INTERFACE("service interface", "service", "%sService.java", "java"),
    SERVICE_IMPL("service implementation", "service.impl", "%sServiceImpl.java", "java"),
    REQUEST_HANDLER("controller", "controller", "%sController.java", "java"),
    MAPPING_CONFIG("mapper XML", null, "%sMapper.xml", "xml");

    private final String displayName;
    private final String subPackage;
    private final String fileNamePattern;
    private final String fenceLanguage;

    LayerKind(String displayName, String subPackage, String fileNamePattern, String fenceLanguage) {
        this.displayName = displayName;
        this.subPackage = subPackage;
        this.fileNamePattern = fileNamePattern;
        this.fenceLanguage = fenceLanguage;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Package segment below the table package, or {@code null} for resource files.
     */
    public String getSubPackage() {
        return subPackage;
    }

    public String fileName(String className) {
        return String.format(fileNamePattern, className);
    }

    public String getFenceLanguage() {
        return fenceLanguage;
    }

    public boolean isJavaSource() {
        return subPackage != null;
    }
}
