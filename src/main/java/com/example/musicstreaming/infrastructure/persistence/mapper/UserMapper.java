package com.example.musicstreaming.infrastructure.persistence.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface UserMapper {

    @Select("SELECT s.playback_quality FROM user_settings s "
            + "JOIN users u ON u.id = s.user_id WHERE u.username = #{username}")
    String selectPlaybackQuality(@Param("username") String username);
}
