package com.starscape.tweets.features.photos.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class TweetPhotoStatusConverter implements AttributeConverter<TweetPhotoStatus, Short> {
    
    @Override
    public Short convertToDatabaseColumn(TweetPhotoStatus status) {
        return status == null ? null : status.code();
    }
    
    @Override
    public TweetPhotoStatus convertToEntityAttribute(Short code) {
        return code == null ? null : TweetPhotoStatus.fromCode(code);
    }
}
