package com.example.musicstreaming.infrastructure.persistence.mapper;

import com.example.musicstreaming.infrastructure.persistence.entity.TrackEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface TrackMapper {

    @Select("SELECT id, file_path, file_modified, title, artist, album, duration_sec, is_deleted "
            + "FROM track WHERE id = #{id}")
    TrackEntity selectById(@Param("id") Long id);
}
