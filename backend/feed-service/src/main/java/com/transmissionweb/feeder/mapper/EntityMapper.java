package com.transmissionweb.feeder.mapper;

import com.transmissionweb.feeder.dto.DownloadedItemDTO;
import com.transmissionweb.feeder.dto.FeedDTO;
import com.transmissionweb.feeder.entity.DownloadedItem;
import com.transmissionweb.feeder.entity.Feed;
import org.springframework.stereotype.Component;

@Component
public class EntityMapper {

    public FeedDTO toDTO(Feed feed) {
        return new FeedDTO(
                feed.getId(),
                feed.getName(),
                feed.getUrl(),
                feed.getPattern(),
                feed.getEnabled(),
                feed.getCheckInterval(),
                feed.getLastChecked(),
                feed.getLastError(),
                feed.getMatchCount(),
                feed.getCreatedAt(),
                feed.getUpdatedAt()
        );
    }

    public DownloadedItemDTO toDTO(DownloadedItem item) {
        return new DownloadedItemDTO(
                item.getId(),
                item.getFeedId(),
                item.getItemGuid(),
                item.getItemTitle(),
                item.getItemLink(),
                item.getDownloadedAt()
        );
    }
}
