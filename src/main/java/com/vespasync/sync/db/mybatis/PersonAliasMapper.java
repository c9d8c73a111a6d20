package com.vespasync.sync.db.mybatis;

import com.vespasync.sync.model.PersonAlias;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.List;

public interface PersonAliasMapper {
    @Select("SELECT external_id, person_id FROM person_aliases")
    List<PersonAlias> selectAll();

    @Select({
            "<script>",
            "SELECT external_id, person_id FROM person_aliases WHERE external_id IN",
            "<foreach collection='keys' item='k' open='(' separator=',' close=')'>#{k}</foreach>",
            "</script>"
    })
    List<PersonAlias> selectByExternalIds(@Param("keys") Collection<String> keys);

    @Insert({
            "<script>",
            "INSERT INTO person_aliases(external_id, person_id, updated_at) VALUES",
            "<foreach collection='rows' item='r' separator=','>(#{r.externalId}, #{r.personId}, now())</foreach>",
            "ON CONFLICT(external_id) DO UPDATE SET person_id=excluded.person_id, updated_at=excluded.updated_at",
            "</script>"
    })
    int upsert(@Param("rows") List<PersonAlias> rows);

    @Select("SELECT COUNT(*) FROM person_aliases")
    long count();
}
