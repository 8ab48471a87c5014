package com.coursepicker.coursepicker_api.model;

import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Course as stored in the catalog and as posted by clients. Loosely validated on purpose:
 * the solver turns it into a checked {@code Course} before use.
 */
@Document("courses")
public class CourseRecord {
    @Id
    private String id;
    private String name;
    private Integer credit;
    private String field;
    private String format;
    private String dates; // e.g. "mon. 09:00-10:30; wed. 09:00-10:30"
    private String semester;

    // Constructors
    public CourseRecord() {}

    public CourseRecord(String name, Integer credit, String field, String format, String dates) {
        this.name = name;
        this.credit = credit;
        this.field = field;
        this.format = format;
        this.dates = dates;
    }

    // Getters
    public String getId() { return id; }
    public String getName() { return name; }
    public Integer getCredit() { return credit; }
    public String getField() { return field; }
    public String getFormat() { return format; }
    public String getDates() { return dates; }
    public String getSemester() { return semester; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setCredit(Integer credit) { this.credit = credit; }
    public void setField(String field) { this.field = field; }
    public void setFormat(String format) { this.format = format; }
    public void setDates(String dates) { this.dates = dates; }
    public void setSemester(String semester) { this.semester = semester; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CourseRecord that = (CourseRecord) o;
        if (id == null || that.id == null) {
            return false;
        }
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CourseRecord{" +
               "name='" + name + '\'' +
               ", credit=" + credit +
               ", field='" + field + '\'' +
               ", format='" + format + '\'' +
               ", dates='" + dates + '\'' +
               ", semester='" + semester + '\'' +
               '}';
    }
}
