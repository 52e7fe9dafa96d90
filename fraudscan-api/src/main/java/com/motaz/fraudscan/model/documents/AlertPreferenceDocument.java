package com.motaz.fraudscan.model.documents;

import com.redis.om.spring.annotations.Document;
import com.redis.om.spring.annotations.Indexed;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;

@Data
@Builder
@Document(value = "fraud:preference", indexName = "AlertPreferenceIdx")
@NoArgsConstructor
@AllArgsConstructor
public class AlertPreferenceDocument {

    @Id
    private String id;                 // "user:<userId>"

    @Indexed
    private String userId;
    private Integer alertThreshold;

}
