package com.vespasync.sync.db.mybatis;

import com.vespasync.sync.model.Person;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.List;

public interface PersonMapper {
    String COLUMNS = "id, email, external_id, name, institution_id, group_name, year_group, course, faculty, " +
            "current_cycle, current_period";

    @Select("SELECT " + COLUMNS + " FROM persons ORDER BY email")
    List<Person> selectAll();

    @Select({
            "<script>",
            "SELECT " + COLUMNS + " FROM persons WHERE email IN",
            "<foreach collection='emails' item='e' open='(' separator=',' close=')'>#{e}</foreach>",
            "</script>"
    })
    List<Person> selectByEmails(@Param("emails") Collection<String> emails);

    @Insert({
            "<script>",
            "INSERT INTO persons(" + COLUMNS + ", updated_at) VALUES",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.id}, #{r.email}, #{r.externalId}, #{r.name}, #{r.institutionId}, #{r.groupName}, #{r.yearGroup}, ",
            "#{r.course}, #{r.faculty}, #{r.currentCycle}, #{r.currentPeriod}, now())",
            "</foreach>",
            "ON CONFLICT(email) DO UPDATE SET external_id=excluded.external_id, name=excluded.name, ",
            "institution_id=excluded.institution_id, group_name=excluded.group_name, year_group=excluded.year_group, ",
            "course=excluded.course, faculty=excluded.faculty, current_cycle=excluded.current_cycle, ",
            "current_period=excluded.current_period, updated_at=excluded.updated_at",
            "</script>"
    })
    int upsert(@Param("rows") List<Person> rows);

    @Select("SELECT COUNT(*) FROM persons")
    long count();
}
