package com.vespasync.sync.db.mybatis;

import com.vespasync.sync.model.Institution;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.List;

public interface InstitutionMapper {
    @Select("SELECT id, external_id, name, status, uses_calendar_year FROM institutions ORDER BY external_id")
    List<Institution> selectAll();

    @Select({
            "<script>",
            "SELECT id, external_id, name, status, uses_calendar_year FROM institutions WHERE external_id IN",
            "<foreach collection='keys' item='k' open='(' separator=',' close=')'>#{k}</foreach>",
            "</script>"
    })
    List<Institution> selectByExternalIds(@Param("keys") Collection<String> keys);

    @Insert({
            "<script>",
            "INSERT INTO institutions(id, external_id, name, status, uses_calendar_year, updated_at) VALUES",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.id}, #{r.externalId}, #{r.name}, #{r.status}, #{r.usesCalendarYear}, now())",
            "</foreach>",
            "ON CONFLICT(external_id) DO UPDATE SET name=excluded.name, status=excluded.status, ",
            "uses_calendar_year=excluded.uses_calendar_year, updated_at=excluded.updated_at",
            "</script>"
    })
    int upsert(@Param("rows") List<Institution> rows);

    @Select("SELECT COUNT(*) FROM institutions")
    long count();
}
