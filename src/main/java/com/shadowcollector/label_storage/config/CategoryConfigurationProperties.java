/**
 * Locations of the category lookup tables
 * Values are Spring resource locations, e.g. classpath:classes.csv or file:/docs/classes.csv
 */

package com.shadowcollector.label_storage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.category")
public class CategoryConfigurationProperties {
    private String classesLocation;
    private String labelIdMapLocation;

    public String getClassesLocation() { return classesLocation; }
    public void setClassesLocation(String classesLocation) { this.classesLocation = classesLocation; }

    public String getLabelIdMapLocation() { return labelIdMapLocation; }
    public void setLabelIdMapLocation(String labelIdMapLocation) { this.labelIdMapLocation = labelIdMapLocation; }
}
