package com.nft.market.nft_market.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.nft.market.nft_market.entity.Sale;

@Repository
public interface SaleRepository extends MongoRepository<Sale, Long> {
    List<Sale> findBySellerOrderByIdDesc(String seller);
}
